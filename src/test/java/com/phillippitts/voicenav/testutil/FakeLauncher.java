package com.phillippitts.voicenav.testutil;

import com.phillippitts.voicenav.service.input.ProcessLauncher;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Records launched files instead of starting processes. */
public class FakeLauncher implements ProcessLauncher {

    public final List<Path> launched = new CopyOnWriteArrayList<>();
    private volatile IOException failure;

    @Override
    public void launch(Path file) throws IOException {
        if (failure != null) {
            throw failure;
        }
        launched.add(file);
    }

    public void failWith(IOException e) {
        this.failure = e;
    }
}
