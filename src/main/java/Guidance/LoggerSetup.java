package Guidance;

import java.io.IOException;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Handle all log message levels
 * 
 * Direct all messages to the console (terminal) and to the log file.
 */
public class LoggerSetup {

    static final String LOG_FILE = "log.txt";
    static final String FORMAT = "%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS.%1$tL %4$-7s [%3$s %2$s] %5$s %6$s%n";

    private LoggerSetup() {}

    /**
     * Replace the root logger handlers with a console handler and an appending log file handler.
     * 
     * @param minimumLevel least severe level logged by the root logger and both handlers
     * @return the root logger
     */
    public static Logger setupLogger(Level minimumLevel) {

    Logger root = Logger.getLogger("");
    root.setUseParentHandlers(false);
    // remove any default handlers
    for(Handler handler : root.getHandlers()) {
        root.removeHandler(handler);
    }

    // SimpleFormatter reads the format once when the class is initialized
    System.setProperty("java.util.logging.SimpleFormatter.format", FORMAT);

    ConsoleHandler consoleHandler = new ConsoleHandler();
    consoleHandler.setFormatter(new SimpleFormatter());
    root.addHandler(consoleHandler);

    try {
        FileHandler logFile = new FileHandler(LOG_FILE, true);
        logFile.setFormatter(new SimpleFormatter());
        root.addHandler(logFile);
    } catch (SecurityException | IOException e) {
        root.log(Level.WARNING, "log file " + LOG_FILE + " not available; logging to the console only", e);
    }

    for(Handler handler : root.getHandlers()) {
        handler.setLevel(minimumLevel);
    }
    root.setLevel(minimumLevel);

    return root;
    }
}
