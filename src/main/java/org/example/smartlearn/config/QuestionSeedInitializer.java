package org.example.smartlearn.config;

import org.example.smartlearn.model.NewQuestion;
import org.example.smartlearn.repository.QuestionRepository;
import org.example.smartlearn.service.QuestionCatalogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConditionalOnProperty(name = "quiz.seed-demo-data", havingValue = "true")
@Order(1)
public class QuestionSeedInitializer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(QuestionSeedInitializer.class);

    private final QuestionRepository questionRepository;
    private final QuestionCatalogService questionCatalogService;

    public QuestionSeedInitializer(QuestionRepository questionRepository, QuestionCatalogService questionCatalogService) {
        this.questionRepository = questionRepository;
        this.questionCatalogService = questionCatalogService;
    }

    @Override
    public void run(String... args) {
        // Only seed an empty catalog
        if (questionRepository.count() > 0) {
            log.info("Question catalog already populated, skipping demo data");
            return;
        }

        List<NewQuestion> questions = List.of(
                question("What is the SI unit of force?", "Joule", "Newton", "Watt", "Pascal", "B",
                        "Physics", "Laws of Motion", "Units", "Easy"),
                question("Which quantity is conserved in an elastic collision besides momentum?",
                        "Kinetic energy", "Temperature", "Pressure", "Charge density", "A",
                        "Physics", "Work and Energy", "Collisions", "Medium"),
                question("What is the acceleration due to gravity near Earth's surface (approx.)?",
                        "1.6 m/s^2", "3.7 m/s^2", "9.8 m/s^2", "24.8 m/s^2", "C",
                        "Physics", "Gravitation", "Free fall", "Easy"),
                question("Which lens is used to correct myopia?", "Convex", "Cylindrical", "Bifocal", "Concave", "D",
                        "Physics", "Optics", "Lenses", "Medium"),
                question("Ohm's law relates voltage, current and what?", "Resistance", "Power", "Frequency", "Mass", "A",
                        "Physics", "Current Electricity", "Circuits", "Easy"),
                question("What is the pH of pure water at 25 degrees Celsius?", "5", "7", "9", "14", "B",
                        "Chemistry", "Acids and Bases", "pH scale", "Easy"),
                question("Which gas is released when zinc reacts with dilute hydrochloric acid?",
                        "Oxygen", "Chlorine", "Hydrogen", "Carbon dioxide", "C",
                        "Chemistry", "Chemical Reactions", "Metals and acids", "Easy"),
                question("What is the atomic number of carbon?", "4", "8", "12", "6", "D",
                        "Chemistry", "Atomic Structure", "Elements", "Easy"),
                question("Which bond is formed by sharing electron pairs?", "Covalent", "Ionic", "Metallic", "Hydrogen", "A",
                        "Chemistry", "Chemical Bonding", "Bond types", "Medium"),
                question("What is the powerhouse of the cell?", "Nucleus", "Mitochondrion", "Ribosome", "Golgi body", "B",
                        "Biology", "Cell Biology", "Organelles", "Easy"),
                question("Which blood cells help in clotting?", "Red blood cells", "White blood cells", "Platelets", "Plasma cells", "C",
                        "Biology", "Human Physiology", "Blood", "Easy"),
                question("Where does photosynthesis mainly take place?", "Roots", "Stem", "Flowers", "Leaves", "D",
                        "Biology", "Plant Physiology", "Photosynthesis", "Easy")
        );

        int created = 0;
        for (NewQuestion question : questions) {
            if (questionCatalogService.addQuestion(question).created()) {
                created++;
            }
        }
        log.info("Seeded {} demo questions", created);
    }

    private NewQuestion question(
            String text,
            String optionA,
            String optionB,
            String optionC,
            String optionD,
            String answer,
            String subject,
            String chapter,
            String topic,
            String difficulty) {
        return new NewQuestion(text, optionA, optionB, optionC, optionD, answer, subject, chapter, topic, difficulty, "MCQ");
    }
}
