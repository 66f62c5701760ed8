package com.sashkomusic.catalogreconciler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SmCatalogReconcilerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SmCatalogReconcilerApplication.class, args);
	}

}
