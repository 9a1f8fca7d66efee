package com.phillippitts.voicenav.service.command.handler;

import com.phillippitts.voicenav.service.command.Command;
import com.phillippitts.voicenav.service.command.handler.keyboard.DeleteLineCommand;
import com.phillippitts.voicenav.service.command.handler.keyboard.KeyPressCommand;
import com.phillippitts.voicenav.service.command.handler.keyboard.ShortcutCommand;
import com.phillippitts.voicenav.service.command.handler.keyboard.TypeSymbolCommand;
import com.phillippitts.voicenav.service.command.handler.keyboard.TypeTextCommand;
import com.phillippitts.voicenav.service.command.handler.mouse.ClickNumberCommand;
import com.phillippitts.voicenav.service.command.handler.mouse.DragBetweenNumbersCommand;
import com.phillippitts.voicenav.service.command.handler.mouse.MouseClickCommand;
import com.phillippitts.voicenav.service.command.handler.mouse.MouseMoveCommand;
import com.phillippitts.voicenav.service.command.handler.mouse.MoveToNumberCommand;
import com.phillippitts.voicenav.service.command.handler.mouse.RefineGridCommand;
import com.phillippitts.voicenav.service.command.handler.mouse.ScrollCommand;
import com.phillippitts.voicenav.service.command.handler.navigation.ArrowKeyCommand;
import com.phillippitts.voicenav.service.command.handler.navigation.HomeEndCommand;
import com.phillippitts.voicenav.service.command.handler.navigation.PageNavigationCommand;
import com.phillippitts.voicenav.service.command.handler.overlay.HideOverlayCommand;
import com.phillippitts.voicenav.service.command.handler.overlay.ShowOverlayCommand;
import com.phillippitts.voicenav.service.command.handler.screenshot.ReferenceScreenshotCommand;
import com.phillippitts.voicenav.service.command.handler.screenshot.ScreenshotCommand;
import com.phillippitts.voicenav.service.command.handler.window.SwitchToWindowCommand;
import com.phillippitts.voicenav.service.command.handler.window.WindowCommand;
import com.phillippitts.voicenav.service.parser.CommandParser;

import java.nio.file.Path;
import java.util.List;

/** The default command set, in registration order. */
public final class BuiltInCommands {

    private BuiltInCommands() {}

    /** Screenshots go to {@link ScreenshotCommand#defaultDirectory()}. */
    public static List<Command> create(CommandParser parser, int gridSize) {
        return create(parser, gridSize, ScreenshotCommand.defaultDirectory());
    }

    public static List<Command> create(CommandParser parser, int gridSize, Path screenshotDirectory) {
        return List.of(
                // keyboard
                KeyPressCommand.enter(),
                KeyPressCommand.tab(),
                KeyPressCommand.escape(),
                KeyPressCommand.space(),
                KeyPressCommand.backspace(),
                ShortcutCommand.deleteWord(),
                new DeleteLineCommand(),
                ShortcutCommand.copy(),
                ShortcutCommand.cut(),
                ShortcutCommand.paste(),
                ShortcutCommand.selectAll(),
                ShortcutCommand.undo(),
                ShortcutCommand.redo(),
                ShortcutCommand.save(),
                new TypeTextCommand(),
                TypeSymbolCommand.prefixed(),
                TypeSymbolCommand.bare(),
                // mouse
                MouseClickCommand.click(),
                MouseClickCommand.rightClick(),
                MouseClickCommand.doubleClick(),
                MouseClickCommand.middleClick(),
                new ScrollCommand(),
                new MouseMoveCommand(),
                new ClickNumberCommand(parser),
                new MoveToNumberCommand(parser),
                new DragBetweenNumbersCommand(parser),
                new RefineGridCommand(parser),
                // navigation
                new ArrowKeyCommand(),
                new PageNavigationCommand(),
                new HomeEndCommand(),
                // window
                WindowCommand.snapLeft(),
                WindowCommand.snapRight(),
                WindowCommand.minimize(),
                WindowCommand.maximize(),
                WindowCommand.close(),
                WindowCommand.switchWindow(),
                new SwitchToWindowCommand(parser),
                // overlays
                ShowOverlayCommand.grid(gridSize),
                ShowOverlayCommand.elements(),
                ShowOverlayCommand.windows(),
                ShowOverlayCommand.help(),
                new HideOverlayCommand(),
                // screenshots
                new ScreenshotCommand(screenshotDirectory),
                new ReferenceScreenshotCommand(parser, screenshotDirectory));
    }
}
