package org.chatrooms;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatroomsApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChatroomsApplication.class, args);
    }
}
