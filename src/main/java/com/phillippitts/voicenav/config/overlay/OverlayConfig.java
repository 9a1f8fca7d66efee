package com.phillippitts.voicenav.config.overlay;

import com.phillippitts.voicenav.config.properties.OverlayProperties;
import com.phillippitts.voicenav.service.command.CommandRegistry;
import com.phillippitts.voicenav.service.events.EventBus;
import com.phillippitts.voicenav.service.health.OverlayHealthIndicator;
import com.phillippitts.voicenav.service.overlay.OverlayCoordinator;
import com.phillippitts.voicenav.service.overlay.ScreenGeometry;
import com.phillippitts.voicenav.service.overlay.element.ElementLocator;
import com.phillippitts.voicenav.service.overlay.element.ElementOverlay;
import com.phillippitts.voicenav.service.overlay.feedback.CommandFeedbackListener;
import com.phillippitts.voicenav.service.overlay.feedback.FeedbackOverlay;
import com.phillippitts.voicenav.service.overlay.grid.GridOverlay;
import com.phillippitts.voicenav.service.overlay.help.HelpOverlay;
import com.phillippitts.voicenav.service.overlay.render.LoggingOverlaySurface;
import com.phillippitts.voicenav.service.overlay.render.OverlaySurface;
import com.phillippitts.voicenav.service.overlay.render.RenderLoop;
import com.phillippitts.voicenav.service.overlay.render.SwingOverlaySurface;
import com.phillippitts.voicenav.service.overlay.window.WindowListOverlay;
import com.phillippitts.voicenav.service.overlay.window.WindowLocator;
import com.phillippitts.voicenav.service.overlay.window.WmctrlWindowLocator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.awt.GraphicsEnvironment;
import java.util.List;
import java.util.Optional;

/**
 * Wires the overlay coordinator and the grid, element, window, help and feedback overlays, each
 * with its own render loop and surface. Overlays close before their loops, disposing the surface
 * once pending redraws have run.
 */
@Configuration
public class OverlayConfig {

    private static final Logger LOG = LogManager.getLogger(OverlayConfig.class);

    private final OverlayProperties props;

    public OverlayConfig(OverlayProperties props) {
        this.props = props;
    }

    @Bean
    public ScreenGeometry screenGeometry() {
        return ScreenGeometry.detect(props.getScreenWidth(), props.getScreenHeight());
    }

    @Bean(destroyMethod = "clearAll")
    public OverlayCoordinator overlayCoordinator(EventBus eventBus) {
        return new OverlayCoordinator(eventBus);
    }

    @Bean(destroyMethod = "close")
    public RenderLoop gridRenderLoop() {
        return new RenderLoop("overlay-grid");
    }

    @Bean(destroyMethod = "close")
    public RenderLoop elementRenderLoop() {
        return new RenderLoop("overlay-element");
    }

    @Bean(destroyMethod = "close")
    public RenderLoop windowRenderLoop() {
        return new RenderLoop("overlay-window");
    }

    @Bean(destroyMethod = "close")
    public RenderLoop helpRenderLoop() {
        return new RenderLoop("overlay-help");
    }

    @Bean(destroyMethod = "close")
    public RenderLoop feedbackRenderLoop() {
        return new RenderLoop("overlay-feedback");
    }

    @Bean(destroyMethod = "close")
    public GridOverlay gridOverlay(OverlayCoordinator coordinator,
                                   @Qualifier("gridRenderLoop") RenderLoop loop,
                                   ScreenGeometry screen) {
        GridOverlay overlay = new GridOverlay(coordinator, loop, surface("grid"), screen, props.getGridSize());
        coordinator.register(overlay);
        return overlay;
    }

    @Bean(destroyMethod = "close")
    public ElementOverlay elementOverlay(OverlayCoordinator coordinator,
                                        @Qualifier("elementRenderLoop") RenderLoop loop,
                                        ScreenGeometry screen,
                                        ObjectProvider<ElementLocator> locator) {
        ElementOverlay overlay = new ElementOverlay(coordinator, loop, surface("element"),
                Optional.ofNullable(locator.getIfAvailable()), screen,
                props.getElementMaxElements(), props.getElementFallbackGridSize());
        coordinator.register(overlay);
        return overlay;
    }

    @Bean
    @ConditionalOnProperty(prefix = "overlay", name = "window-locator", havingValue = "wmctrl")
    public WindowLocator wmctrlWindowLocator() {
        return new WmctrlWindowLocator();
    }

    @Bean(destroyMethod = "close")
    public WindowListOverlay windowListOverlay(OverlayCoordinator coordinator,
                                               @Qualifier("windowRenderLoop") RenderLoop loop,
                                               ScreenGeometry screen,
                                               ObjectProvider<WindowLocator> locator) {
        WindowListOverlay overlay = new WindowListOverlay(coordinator, loop, surface("window"),
                Optional.ofNullable(locator.getIfAvailable()), screen, props.getWindowMaxWindows());
        coordinator.register(overlay);
        return overlay;
    }

    @Bean(destroyMethod = "close")
    public HelpOverlay helpOverlay(OverlayCoordinator coordinator,
                                   @Qualifier("helpRenderLoop") RenderLoop loop,
                                   ScreenGeometry screen,
                                   CommandRegistry registry) {
        HelpOverlay overlay = new HelpOverlay(coordinator, loop, surface("help"), registry::getHelpText, screen);
        coordinator.register(overlay);
        return overlay;
    }

    @Bean(destroyMethod = "close")
    public FeedbackOverlay feedbackOverlay(@Qualifier("feedbackRenderLoop") RenderLoop loop,
                                           ScreenGeometry screen,
                                           EventBus eventBus) {
        FeedbackOverlay feedback = new FeedbackOverlay(loop, surface("feedback"), screen,
                props.getFeedbackDurationMs());
        if (props.isFeedbackEnabled()) {
            new CommandFeedbackListener(feedback).attach(eventBus);
        }
        return feedback;
    }

    @Bean
    public OverlayHealthIndicator overlayHealthIndicator(OverlayCoordinator coordinator,
                                                         @Qualifier("gridRenderLoop") RenderLoop grid,
                                                         @Qualifier("elementRenderLoop") RenderLoop element,
                                                         @Qualifier("windowRenderLoop") RenderLoop window,
                                                         @Qualifier("helpRenderLoop") RenderLoop help,
                                                         @Qualifier("feedbackRenderLoop") RenderLoop feedback) {
        return new OverlayHealthIndicator(coordinator, List.of(grid, element, window, help, feedback));
    }

    // Package-private for tests
    OverlaySurface surface(String name) {
        if (props.isSwingRenderer()) {
            if (!GraphicsEnvironment.isHeadless()) {
                return new SwingOverlaySurface(name);
            }
            LOG.warn("overlay.renderer=swing but no display is available; logging {} frames instead", name);
        }
        return new LoggingOverlaySurface(name);
    }
}
