package com.vidnyan.codeguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CodeGuard - heuristic defensive and semantic static analysis.
 * <p>
 * Parses Java sources with JavaParser, runs rule-driven detectors over every
 * file and predicts integration failures between components.
 */
@SpringBootApplication
public class CodeGuardApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CodeGuardApplication.class, args)));
    }
}
