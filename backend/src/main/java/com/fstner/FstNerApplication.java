package com.fstner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * fst-ner - finite-state transducer named entity recognition service.
 */
@SpringBootApplication
public class FstNerApplication {

	public static void main(String[] args) {
		SpringApplication.run(FstNerApplication.class, args);
	}

}
