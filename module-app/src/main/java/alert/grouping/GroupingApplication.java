package alert.grouping;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GroupingApplication {

  public static void main(String[] args) {
    SpringApplication.run(GroupingApplication.class, args);
  }
}
