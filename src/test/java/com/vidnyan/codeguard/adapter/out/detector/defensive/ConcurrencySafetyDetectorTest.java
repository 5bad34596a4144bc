package com.vidnyan.codeguard.adapter.out.detector.defensive;

import com.vidnyan.codeguard.domain.model.Violation;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.support.SyntaxTrees;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencySafetyDetectorTest {

    private final ConcurrencySafetyDetector detector = new ConcurrencySafetyDetector();

    @Test
    void detect_ShouldFlagUnsynchronizedFieldWrites() {
        // Arrange
        String source = """
                class Counter {
                    private int count;
                    private final Lock lock = new ReentrantLock();

                    Counter(int start) {
                        this.count = start;
                    }

                    void increment() {
                        this.count++;
                    }

                    synchronized void reset() {
                        this.count = 0;
                    }

                    void add(int n) {
                        lock.lock();
                        try {
                            this.count += n;
                        } finally {
                            lock.unlock();
                        }
                    }
                }
                """;

        // Act
        List<Violation> violations = detector.detect(SyntaxTrees.context(source));

        // Assert
        assertEquals(1, violations.size());
        assertEquals(ViolationType.CONCURRENCY_SAFETY, violations.get(0).type());
        assertEquals(10, violations.get(0).line());
        assertEquals("Shared field 'count' modified without synchronization", violations.get(0).description());
    }
}
