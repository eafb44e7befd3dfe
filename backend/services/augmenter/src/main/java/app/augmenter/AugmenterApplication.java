package app.augmenter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AugmenterApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(AugmenterApplication.class, args)));
	}

}
