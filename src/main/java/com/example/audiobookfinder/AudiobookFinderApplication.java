package com.example.audiobookfinder;

import com.example.audiobookfinder.common.config.AppDownloadProperties;
import com.example.audiobookfinder.common.config.AppLibraryProperties;
import com.example.audiobookfinder.common.config.AppSearchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AppLibraryProperties.class,
        AppSearchProperties.class,
        AppDownloadProperties.class
})
public class AudiobookFinderApplication {

    public static void main(String[] args) {
        SpringApplication.run(AudiobookFinderApplication.class, args);
    }
}
