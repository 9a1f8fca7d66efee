package com.phillippitts.voicenav;

import com.phillippitts.voicenav.config.properties.CustomCommandsProperties;
import com.phillippitts.voicenav.config.properties.HotkeyProperties;
import com.phillippitts.voicenav.config.properties.OverlayProperties;
import com.phillippitts.voicenav.config.properties.ScreenshotProperties;
import com.phillippitts.voicenav.config.properties.TextProcessingProperties;
import com.phillippitts.voicenav.config.properties.TypingProperties;
import com.phillippitts.voicenav.config.properties.VoiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        VoiceProperties.class,
        TextProcessingProperties.class,
        OverlayProperties.class,
        TypingProperties.class,
        CustomCommandsProperties.class,
        HotkeyProperties.class,
        ScreenshotProperties.class
})
public class VoiceNavApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(VoiceNavApplication.class);
        // overlays and java.awt.Robot need a display
        app.setHeadless(false);
        app.run(args);
    }

}
