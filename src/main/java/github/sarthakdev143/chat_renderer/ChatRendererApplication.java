package github.sarthakdev143.chat_renderer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ChatRendererApplication {

	public static void main(String[] args) {
		SpringApplication.run(ChatRendererApplication.class, args);
	}

}
