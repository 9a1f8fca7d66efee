package com.phillippitts.voicenav.service.overlay.window;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WmctrlWindowLocatorTest {

    private static final String LISTING = String.join("\n",
            "0x03a00003  0 workstation Terminal - bash",
            "0x04000007  0 workstation README.md - Visual Studio Code",
            "0x0460000a -1 workstation",
            "0x05200001  1 workstation Inbox   (3) - Mail",
            "");

    @Test
    void parsesIdsAndTitlesSkippingUntitledWindows() {
        assertThat(WmctrlWindowLocator.parse(LISTING, 20)).containsExactly(
                new WindowInfo("0x03a00003", "Terminal - bash"),
                new WindowInfo("0x04000007", "README.md - Visual Studio Code"),
                new WindowInfo("0x05200001", "Inbox   (3) - Mail"));
    }

    @Test
    void stopsAtMaxWindows() {
        assertThat(WmctrlWindowLocator.parse(LISTING, 1)).extracting(WindowInfo::id).containsExactly("0x03a00003");
    }

    @Test
    void emptyOutputYieldsNoWindows() {
        assertThat(WmctrlWindowLocator.parse("", 20)).isEmpty();
    }

    @Test
    void missingToolListsNothing() {
        WmctrlWindowLocator locator = new WmctrlWindowLocator("/nonexistent/voicenav-wmctrl");

        assertThat(locator.listWindows(20)).isEmpty();
    }

    @Test
    void missingToolFailsActivation() {
        WmctrlWindowLocator locator = new WmctrlWindowLocator("/nonexistent/voicenav-wmctrl");

        assertThatThrownBy(() -> locator.activate(new WindowInfo("0x01", "Terminal")))
                .isInstanceOf(IOException.class);
    }
}
