package dev.univer.expensebot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExpenseCaptureBotApplication {
    public static void main(String[] args) {
        SpringApplication.run(ExpenseCaptureBotApplication.class, args);
    }
}
