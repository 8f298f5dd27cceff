package ca.weblite.qrstudio.javafx;

/**
 * Plain main class for running from a class-path jar, where the launcher
 * refuses to start a main class that extends {@code Application}.
 */
public class QrStudioFxLauncher {

    public static void main(String[] args) {
        QrStudioFxApp.main(args);
    }
}
