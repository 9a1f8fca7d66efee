package com.phillippitts.voicenav.config.command;

import com.phillippitts.voicenav.config.properties.CustomCommandsProperties;
import com.phillippitts.voicenav.config.properties.OverlayProperties;
import com.phillippitts.voicenav.config.properties.ScreenshotProperties;
import com.phillippitts.voicenav.config.properties.TextProcessingProperties;
import com.phillippitts.voicenav.config.properties.TypingProperties;
import com.phillippitts.voicenav.config.properties.VoiceProperties;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandRegistry;
import com.phillippitts.voicenav.service.command.handler.BuiltInCommands;
import com.phillippitts.voicenav.service.command.handler.custom.CustomCommandLoader;
import com.phillippitts.voicenav.service.events.EventBus;
import com.phillippitts.voicenav.service.input.AwtClipboardAccess;
import com.phillippitts.voicenav.service.input.ClipboardAccess;
import com.phillippitts.voicenav.service.input.DefaultProcessLauncher;
import com.phillippitts.voicenav.service.input.ProcessLauncher;
import com.phillippitts.voicenav.service.input.RobotInputController;
import com.phillippitts.voicenav.service.input.RobotScreenCapture;
import com.phillippitts.voicenav.service.input.ScreenCapture;
import com.phillippitts.voicenav.service.metrics.CommandMetrics;
import com.phillippitts.voicenav.service.overlay.OverlayCoordinator;
import com.phillippitts.voicenav.service.overlay.ScreenGeometry;
import com.phillippitts.voicenav.service.parser.CommandParser;
import com.phillippitts.voicenav.service.parser.NumberMappings;
import com.phillippitts.voicenav.service.pipeline.SpeechTranscriber;
import com.phillippitts.voicenav.service.pipeline.UtteranceProcessor;
import com.phillippitts.voicenav.service.text.TextProcessor;
import com.phillippitts.voicenav.service.typing.StrategyChainTypingService;
import com.phillippitts.voicenav.service.typing.TypingService;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the dispatch engine: parser, registry with built-in and custom commands, input
 * capabilities, typing chain and the utterance pipeline.
 */
@Configuration
public class CommandConfig {

    private static final Logger LOG = LogManager.getLogger(CommandConfig.class);

    @Bean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean
    public CommandMetrics commandMetrics(MeterRegistry registry) {
        return new CommandMetrics(registry);
    }

    @Bean
    public CommandParser commandParser(VoiceProperties voice) {
        NumberMappings numbers = NumberMappings.load(voice.getNumberMappingsPath());
        return new CommandParser(numbers, voice.getIgnoredWords(), voice.getFuzzyThreshold());
    }

    @Bean
    public CommandRegistry commandRegistry(EventBus eventBus,
                                           CommandParser parser,
                                           OverlayProperties overlay,
                                           ScreenshotProperties screenshots,
                                           CustomCommandsProperties customCommands) {
        CommandRegistry registry = new CommandRegistry(eventBus);
        registry.registerAll(BuiltInCommands.create(parser, overlay.getGridSize(), screenshots.getDirectory()));
        registry.registerAll(new CustomCommandLoader().load(customCommands));
        LOG.info("Command registry ready: {} commands", registry.getCommandCount());
        return registry;
    }

    @Bean
    public RobotInputController robotInputController() {
        return new RobotInputController();
    }

    @Bean
    public ClipboardAccess clipboardAccess() {
        return new AwtClipboardAccess();
    }

    @Bean
    public ProcessLauncher processLauncher() {
        return new DefaultProcessLauncher();
    }

    @Bean
    public ScreenCapture screenCapture() {
        return new RobotScreenCapture();
    }

    @Bean
    public CommandContext commandContext(RobotInputController input,
                                         ClipboardAccess clipboard,
                                         ProcessLauncher launcher,
                                         ScreenCapture screenCapture,
                                         OverlayCoordinator overlays,
                                         EventBus eventBus,
                                         ScreenGeometry screen) {
        return CommandContext.builder()
                .keyboard(input)
                .mouse(input)
                .clipboard(clipboard)
                .launcher(launcher)
                .screenCapture(screenCapture)
                .overlays(overlays)
                .eventBus(eventBus)
                .screenSize(screen.getWidth(), screen.getHeight())
                .build();
    }

    @Bean
    public TextProcessor textProcessor(TextProcessingProperties props) {
        return new TextProcessor(props);
    }

    @Bean
    public TypingService typingService(TypingProperties props,
                                       RobotInputController input,
                                       ClipboardAccess clipboard,
                                       ApplicationEventPublisher publisher) {
        return new StrategyChainTypingService(props, clipboard, input, input, input::isAvailable, publisher);
    }

    @Bean
    public UtteranceProcessor utteranceProcessor(TextProcessor textProcessor,
                                                 CommandParser parser,
                                                 CommandRegistry registry,
                                                 CommandContext context,
                                                 TypingService typing,
                                                 EventBus eventBus,
                                                 VoiceProperties voice,
                                                 ObjectProvider<SpeechTranscriber> transcriber) {
        SpeechTranscriber stt = transcriber.getIfAvailable();
        if (stt == null) {
            LOG.info("No speech transcriber configured; accepting text utterances only");
        }
        return new UtteranceProcessor(textProcessor, parser, registry, context, typing, eventBus,
                voice.isCommandOnlyMode(), stt);
    }
}
