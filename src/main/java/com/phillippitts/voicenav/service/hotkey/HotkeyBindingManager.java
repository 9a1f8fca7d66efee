package com.phillippitts.voicenav.service.hotkey;

import com.phillippitts.voicenav.service.hotkey.event.HotkeyConflictEvent;
import com.phillippitts.voicenav.service.hotkey.event.HotkeyPermissionDeniedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Registers the global key hook and dispatches the utterance of each binding whose
 * combination is pressed.
 * Tests should inject a fake GlobalKeyHook and emit NormalizedKeyEvent instances
 * directly to the registered listener.
 */
public class HotkeyBindingManager implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(HotkeyBindingManager.class);

    private final GlobalKeyHook hook;
    private final List<HotkeyBinding> bindings;
    private final List<String> reserved;
    private final Consumer<String> dispatcher;
    private final ApplicationEventPublisher publisher;

    private volatile boolean running;

    public HotkeyBindingManager(GlobalKeyHook hook,
                                List<HotkeyBinding> bindings,
                                List<String> reserved,
                                Consumer<String> dispatcher,
                                ApplicationEventPublisher publisher) {
        this.hook = Objects.requireNonNull(hook, "hook must not be null");
        this.bindings = List.copyOf(bindings);
        this.reserved = List.copyOf(reserved);
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        if (bindings.isEmpty()) {
            LOG.info("No hotkey bindings configured; global hook not registered");
            return;
        }
        detectReservedConflicts();
        try {
            hook.addListener(this::onKey);
            hook.register();
            running = true;
            LOG.info("Hotkeys active: {}", bindings.stream().map(HotkeyBinding::describe).toList());
        } catch (SecurityException se) {
            LOG.warn("Global key hook permission denied: {}", se.toString());
            publisher.publishEvent(new HotkeyPermissionDeniedEvent(se.getMessage(), Instant.now()));
        } catch (RuntimeException e) {
            // voice and REST input keep working without hotkeys
            LOG.error("Failed to start hotkeys", e);
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        try {
            hook.unregister();
        } catch (RuntimeException e) {
            LOG.debug("Error unregistering global key hook: {}", e.toString());
        }
        running = false;
        LOG.info("Hotkeys stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public List<HotkeyBinding> getBindings() {
        return bindings;
    }

    // Package-private for tests
    void onKey(NormalizedKeyEvent e) {
        for (HotkeyBinding b : bindings) {
            if (b.matches(e)) {
                LOG.debug("Hotkey {} -> '{}'", b.describe(), b.utterance());
                dispatcher.accept(b.utterance());
                return;
            }
        }
    }

    private void detectReservedConflicts() {
        for (HotkeyBinding b : bindings) {
            for (String combination : reserved) {
                if (KeyNameMapper.matchesCombination(b.modifiers(), b.key(), combination)) {
                    LOG.warn("Hotkey '{}' ({}) conflicts with reserved '{}'", b.name(), b.describe(), combination);
                    publisher.publishEvent(new HotkeyConflictEvent(b.name(), combination, Instant.now()));
                }
            }
        }
    }
}
