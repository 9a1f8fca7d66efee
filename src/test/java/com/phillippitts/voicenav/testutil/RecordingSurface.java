package com.phillippitts.voicenav.testutil;

import com.phillippitts.voicenav.service.overlay.render.OverlayFrame;
import com.phillippitts.voicenav.service.overlay.render.OverlaySurface;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Surface that records each call as "call@thread". */
public class RecordingSurface implements OverlaySurface {

    public final List<String> calls = new CopyOnWriteArrayList<>();

    @Override
    public void draw(OverlayFrame frame) {
        record("draw");
    }

    @Override
    public void clear() {
        record("clear");
    }

    @Override
    public void dispose() {
        record("dispose");
    }

    public List<String> names() {
        return calls.stream().map(c -> c.substring(0, c.indexOf('@'))).toList();
    }

    private void record(String call) {
        calls.add(call + "@" + Thread.currentThread().getName());
    }
}
