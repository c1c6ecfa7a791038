package org.example.smartlearn.service;

import org.example.smartlearn.model.SessionView;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory store of the current session per learner. Every state change for a learner runs
 * under that learner's lock; different learners never share a lock.
 */
@Component
public class QuizSessionRegistry {

    private final ConcurrentHashMap<String, LearnerSlot> slots = new ConcurrentHashMap<>();

    /**
     * Runs {@code action} under the learner's lock. A slot left without a session is dropped once
     * no other caller is queued on it, so the map only holds learners with a live session.
     */
    public <T> T withLearner(String studentId, Function<LearnerSlot, T> action) {
        while (true) {
            LearnerSlot slot = slots.computeIfAbsent(studentId, ignored -> new LearnerSlot());
            slot.lock.lock();
            try {
                if (slots.get(studentId) != slot) {
                    // evicted while we waited; retry on the current slot
                    continue;
                }
                try {
                    return action.apply(slot);
                } finally {
                    if (slot.session == null && !slot.lock.hasQueuedThreads()) {
                        slots.remove(studentId, slot);
                    }
                }
            } finally {
                slot.lock.unlock();
            }
        }
    }

    int learnerCount() {
        return slots.size();
    }

    public SessionView view(String studentId) {
        LearnerSlot slot = slots.get(studentId);
        if (slot == null) {
            return SessionView.empty(studentId);
        }
        slot.lock.lock();
        try {
            return slot.session == null ? SessionView.empty(studentId) : slot.session.toView();
        } finally {
            slot.lock.unlock();
        }
    }

    public static final class LearnerSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private QuizSession session;

        public QuizSession getSession() {
            return session;
        }

        void replace(QuizSession next) {
            this.session = next;
        }

        void clear() {
            this.session = null;
        }
    }
}
