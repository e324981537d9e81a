package com.smurthy.ai.shopping;

import com.smurthy.ai.shopping.config.EmissionsProperties;
import com.smurthy.ai.shopping.config.RegistryProperties;
import com.smurthy.ai.shopping.config.RouterProperties;
import com.smurthy.ai.shopping.config.SessionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
		RouterProperties.class,
		RegistryProperties.class,
		SessionProperties.class,
		EmissionsProperties.class
})
public class ShoppingAssistantApplication {

	public static void main(String[] args) {
		SpringApplication.run(ShoppingAssistantApplication.class, args);
	}

}
