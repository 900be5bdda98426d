package lovedata.menus.cleaning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MenuCleaningApplication {

    public static void main(String[] args) {
        SpringApplication.run(MenuCleaningApplication.class, args);
    }
}
