package com.myorg.choirsplit;

import com.myorg.choirsplit.config.SplitterProperties;
import com.myorg.choirsplit.config.StorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({StorageProperties.class, SplitterProperties.class})
public class ChoirSplitApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChoirSplitApplication.class, args);
    }
}
