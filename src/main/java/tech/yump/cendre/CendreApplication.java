package tech.yump.cendre;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.cendre.config.CendreProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(CendreProperties.class)
public class CendreApplication {

  public static void main(String[] args) {
    SpringApplication.run(CendreApplication.class, args);
    log.info(">>> Cendre Application Started <<<");
  }
}
