package com.example.demo.sheetgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetGenApplication {

	public static void main(String[] args) {
		SpringApplication.run(SheetGenApplication.class, args);
	}

}
