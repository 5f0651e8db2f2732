package com.vidnyan.cga;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CGA - Call Graph Analyzer
 *
 * Builds a cross-file call graph for Java, Python, TypeScript and JavaScript projects
 * and answers reachability and impact queries over it.
 */
@SpringBootApplication
public class CgaApplication {

    public static void main(String[] args) {
        SpringApplication.run(CgaApplication.class, args);
    }
}
