package Guidance;

import java.util.NoSuchElementException;
import java.util.Scanner;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

// Read operator commands from the terminal while frames are replayed
class Keystroke implements Runnable
{
        private static final Logger LOGGER = Logger.getLogger(Keystroke.class.getName());
        static {
          LOGGER.finest("Loading");
        }

    // commands returned by getKey
    static final int keyTerminate = 'q';
    static final int keyCapture = 'c';
    static final int keyReset = 'r';
    static final int keyNone = -1;  // no key pressed since the last getKey

    private final Scanner keyboard;

    AtomicInteger dokeystroke = new AtomicInteger(keyNone);

    Keystroke()
    {
        this(new Scanner(System.in));
    }

    Keystroke(Scanner keyboard)
    {
        this.keyboard = keyboard;
    }

    /**
     * Read the terminal for user entered commands.
     * 
     * Scanner blocks waiting for input so this must be run in its own thread.
     * 
     * Type a character command and press Enter.
     * The first letter entered is interpreted as a command; the rest is ignored.
     */
    public void run()
    {
        try (keyboard)
        {
            while( ! Thread.interrupted())
            {
                System.out.println("press c (capture), r (reset session), q (quit) then the Enter key");
                String entered = keyboard.next();
                int key = command(entered);
                if (key == keyNone)
                {
                    LOGGER.info(entered + " not a command");
                }
                else
                {
                    LOGGER.finest("user entered " + entered + ", action is " + (char)key);
                    dokeystroke.set(key);
                }
            }
        } catch(NoSuchElementException | IllegalStateException e) {
            LOGGER.severe("Terminal keyboard closed prematurely (Ctrl-c) or doesn't exist " + e);
        }
    }

    /**
     * @return the command of the first letter entered, keyNone if it is not a command
     */
    static int command(String entered)
    {
        if (entered == null || entered.isEmpty())
        {
            return keyNone;
        }
        switch (Character.toLowerCase(entered.charAt(0)))
        {
            case 'c': return keyCapture;
            case 'r': return keyReset;
            case 'q': return keyTerminate;
            default: return keyNone;
        }
    }

    /**
     * Get the command entered on the terminal and forget it
     * @return the character command or keyNone
     */
    public int getKey() {
        return dokeystroke.getAndSet(keyNone);
    }
}
