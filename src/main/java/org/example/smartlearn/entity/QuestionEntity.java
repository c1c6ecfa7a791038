package org.example.smartlearn.entity;

import jakarta.persistence.*;

@Entity
@Table(
        name = "questions",
        uniqueConstraints = @UniqueConstraint(columnNames = {"question_text"})
)
public class QuestionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "question_text", nullable = false, length = 2000)
    private String questionText;

    @Column(nullable = false, length = 1000)
    private String optionA;

    @Column(nullable = false, length = 1000)
    private String optionB;

    @Column(nullable = false, length = 1000)
    private String optionC;

    @Column(nullable = false, length = 1000)
    private String optionD;

    @Column(nullable = false, length = 16)
    private String answer; // canonical letter; only the first character is significant

    private String subject;
    private String chapter;
    private String topic;
    private String difficulty; // "Easy", "Medium", "Hard"

    @Column(name = "question_type")
    private String type;

    public QuestionEntity() {}

    public QuestionEntity(String questionText, String optionA, String optionB, String optionC, String optionD, String answer) {
        this.questionText = questionText;
        this.optionA = optionA;
        this.optionB = optionB;
        this.optionC = optionC;
        this.optionD = optionD;
        this.answer = answer;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getQuestionText() { return questionText; }
    public void setQuestionText(String questionText) { this.questionText = questionText; }

    public String getOptionA() { return optionA; }
    public void setOptionA(String optionA) { this.optionA = optionA; }

    public String getOptionB() { return optionB; }
    public void setOptionB(String optionB) { this.optionB = optionB; }

    public String getOptionC() { return optionC; }
    public void setOptionC(String optionC) { this.optionC = optionC; }

    public String getOptionD() { return optionD; }
    public void setOptionD(String optionD) { this.optionD = optionD; }

    public String getAnswer() { return answer; }
    public void setAnswer(String answer) { this.answer = answer; }

    public String getSubject() { return subject; }
    public void setSubject(String subject) { this.subject = subject; }

    public String getChapter() { return chapter; }
    public void setChapter(String chapter) { this.chapter = chapter; }

    public String getTopic() { return topic; }
    public void setTopic(String topic) { this.topic = topic; }

    public String getDifficulty() { return difficulty; }
    public void setDifficulty(String difficulty) { this.difficulty = difficulty; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
}
