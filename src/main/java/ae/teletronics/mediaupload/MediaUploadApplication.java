package ae.teletronics.mediaupload;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MediaUploadApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaUploadApplication.class, args);
    }
}
