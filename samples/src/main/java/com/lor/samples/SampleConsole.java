package com.lor.samples;

import lombok.extern.slf4j.Slf4j;
import org.apache.logging.log4j.LogManager;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * This is a sample console writing its log to the exchange configured in log4j2.xml.
 * Every line read from the console produces a debug event, every other one an error.
 */
@Slf4j
public class SampleConsole {

    private static final int ITERATIONS = 10;

    public static void main(String[] args) throws IOException {
        BufferedReader console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        log.debug("Application start");
        for (int i = 0; i < ITERATIONS; i++) {
            console.readLine();
            log.debug("Debug {}", i);
            if (i % 2 == 0) {
                try {
                    throw new IllegalStateException("dummy exception!!");
                } catch (IllegalStateException e) {
                    log.error("Error {}: {}", i, e.getMessage(), e);
                }
            }
        }
        log.debug("Application end");
        LogManager.shutdown();

        System.out.println("Press enter to exit the application...");
        console.readLine();
    }
}
