package com.phillippitts.voicenav.config.hotkey;

import com.phillippitts.voicenav.config.properties.HotkeyProperties;
import com.phillippitts.voicenav.service.hotkey.GlobalKeyHook;
import com.phillippitts.voicenav.service.hotkey.HotkeyBindingManager;
import com.phillippitts.voicenav.service.hotkey.impl.JNativeHookGlobalKeyHook;
import com.phillippitts.voicenav.service.pipeline.UtteranceProcessor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires global hotkeys. Disabled with {@code hotkeys.enabled=false}.
 */
@Configuration
@ConditionalOnProperty(prefix = "hotkeys", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HotkeyConfig {

    @Bean
    public GlobalKeyHook globalKeyHook() {
        return new JNativeHookGlobalKeyHook();
    }

    @Bean
    public HotkeyBindingManager hotkeyBindingManager(HotkeyProperties props,
                                                     GlobalKeyHook hook,
                                                     UtteranceProcessor processor,
                                                     @Qualifier("utteranceExecutor") Executor executor,
                                                     ApplicationEventPublisher publisher) {
        HotkeyConfigurationValidator validator = new HotkeyConfigurationValidator(props);
        return new HotkeyBindingManager(hook, validator.validBindings(), props.getReserved(),
                utterance -> executor.execute(() -> processor.process(utterance)), publisher);
    }
}
