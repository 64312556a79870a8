package com.di.tablenova;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TableNovaApplication {

	public static void main(String[] args) {
		SpringApplication.run(TableNovaApplication.class, args);
	}
}
