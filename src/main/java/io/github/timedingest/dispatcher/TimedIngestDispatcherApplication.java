package io.github.timedingest.dispatcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TimedIngestDispatcherApplication {

	public static void main(String[] args) {
		SpringApplication.run(TimedIngestDispatcherApplication.class, args);
	}

}
