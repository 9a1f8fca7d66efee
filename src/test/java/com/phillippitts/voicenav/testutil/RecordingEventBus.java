package com.phillippitts.voicenav.testutil;

import com.phillippitts.voicenav.service.events.EventBus;
import com.phillippitts.voicenav.service.events.EventType;
import com.phillippitts.voicenav.service.events.VoiceEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** EventBus that also records every event it delivers, in publication order. */
public class RecordingEventBus extends EventBus {

    public final List<VoiceEvent> published = new CopyOnWriteArrayList<>();

    @Override
    public void publish(VoiceEvent event) {
        published.add(event);
        super.publish(event);
    }

    public List<EventType> types() {
        return published.stream().map(VoiceEvent::type).toList();
    }

    public List<VoiceEvent> ofType(EventType type) {
        return published.stream().filter(e -> e.type() == type).toList();
    }

    public void clear() {
        published.clear();
    }
}
