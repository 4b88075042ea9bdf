package fleet.dashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FleetDashboardApplication {

  public static void main(String[] args) {
    SpringApplication.run(FleetDashboardApplication.class, args);
  }
}
