package my.blacklitterman.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlackLittermanApplication {
	public static void main(String[] args) {
		SpringApplication.run(BlackLittermanApplication.class, args);
	}
}
