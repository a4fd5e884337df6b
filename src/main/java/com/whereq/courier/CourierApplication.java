package com.whereq.courier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Courier.
 * This service queues questions asked in chat conversations and delivers the
 * generated answers back to them once they are ready.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class CourierApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourierApplication.class, args);
    }
}
