package com.factmarrow;

import com.factmarrow.config.FactMarrowProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(FactMarrowProperties.class)
public class FactMarrowApplication {

	public static void main(String[] args) {
		SpringApplication.run(FactMarrowApplication.class, args);
	}

}
