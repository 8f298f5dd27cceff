package ca.weblite.qrstudio.swing;

import ca.weblite.qrstudio.QrGenerationPipeline;
import ca.weblite.qrstudio.QrStudio;
import ca.weblite.qrstudio.QrStudioConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.JFrame;
import javax.swing.JMenu;
import javax.swing.JMenuBar;
import javax.swing.JMenuItem;
import javax.swing.JOptionPane;
import javax.swing.SwingUtilities;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;

/**
 * Swing entry point.
 *
 * <p>Builds the window, starts the generation pipeline and submits the
 * configured initial request so a symbol shows immediately.</p>
 */
public class QrStudioSwingApp {

    private static final Logger log = LoggerFactory.getLogger(QrStudioSwingApp.class);

    private QrGenerationPipeline pipeline;
    private QrStudioPanel panel;

    public static void main(String[] args) {
        QrStudioConfig config = QrStudioConfig.fromSystemProperties();
        SwingUtilities.invokeLater(() -> new QrStudioSwingApp().show(config));
    }

    void show(QrStudioConfig config) {
        // results arrive on the EDT, after panel is assigned below
        pipeline = config.createPipeline(new SwingResultSink(result -> panel.showResult(result)));
        panel = new QrStudioPanel(pipeline);

        JFrame frame = new JFrame(QrStudio.APP_NAME);
        frame.setDefaultCloseOperation(JFrame.DISPOSE_ON_CLOSE);
        frame.setJMenuBar(createMenuBar(frame, panel));
        frame.setContentPane(panel);
        frame.addWindowListener(new WindowAdapter() {
            @Override
            public void windowClosed(WindowEvent e) {
                pipeline.shutdown();
            }
        });

        pipeline.start();
        panel.applyRequest(config.getInitialRequest());

        frame.setSize(720, 760);
        frame.setLocationRelativeTo(null);
        frame.setVisible(true);
        log.info("{} {} started", QrStudio.APP_NAME, QrStudio.getVersion());
    }

    private static JMenuBar createMenuBar(JFrame frame, QrStudioPanel panel) {
        JMenuItem save = new JMenuItem("Save PNG...");
        save.addActionListener(e -> {
            if (panel.isSaveEnabled()) {
                panel.chooseFileAndSave();
            }
        });
        JMenuItem quit = new JMenuItem("Quit");
        quit.addActionListener(e -> frame.dispose());

        JMenu file = new JMenu("File");
        file.add(save);
        file.addSeparator();
        file.add(quit);

        JMenuItem about = new JMenuItem("About " + QrStudio.APP_NAME);
        about.addActionListener(e -> JOptionPane.showMessageDialog(frame,
                QrStudio.APP_NAME + " " + QrStudio.getVersion() + "\nLive QR code generator",
                "About", JOptionPane.INFORMATION_MESSAGE));
        JMenu help = new JMenu("Help");
        help.add(about);

        JMenuBar bar = new JMenuBar();
        bar.add(file);
        bar.add(help);
        return bar;
    }
}
