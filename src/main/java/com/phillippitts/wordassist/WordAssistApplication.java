package com.phillippitts.wordassist;

import com.phillippitts.wordassist.config.properties.ConfigStoreProperties;
import com.phillippitts.wordassist.config.properties.OrchestrationProperties;
import com.phillippitts.wordassist.config.properties.ProviderHttpProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        OrchestrationProperties.class,
        ConfigStoreProperties.class,
        ProviderHttpProperties.class
})
@EnableScheduling
public class WordAssistApplication {

    public static void main(String[] args) {
        SpringApplication.run(WordAssistApplication.class, args);
    }

}
