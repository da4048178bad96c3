package Guidance;

import java.util.Scanner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class KeystrokeTest {

    @Test
    @DisplayName("The first letter of the entry selects the command")
    void command_Letters() {
        assertThat(Keystroke.command("c")).isEqualTo(Keystroke.keyCapture);
        assertThat(Keystroke.command("Capture")).isEqualTo(Keystroke.keyCapture);
        assertThat(Keystroke.command("r")).isEqualTo(Keystroke.keyReset);
        assertThat(Keystroke.command("quit")).isEqualTo(Keystroke.keyTerminate);
        assertThat(Keystroke.command("x")).isEqualTo(Keystroke.keyNone);
        assertThat(Keystroke.command("")).isEqualTo(Keystroke.keyNone);
    }

    @Test
    @DisplayName("The last command entered is returned once")
    void getKey_AfterInput_ReturnedOnce() {
        Keystroke keystroke = new Keystroke(new Scanner("x c"));

        keystroke.run(); // ends when the input is exhausted

        assertThat(keystroke.getKey()).isEqualTo(Keystroke.keyCapture);
        assertThat(keystroke.getKey()).isEqualTo(Keystroke.keyNone);
    }
}
