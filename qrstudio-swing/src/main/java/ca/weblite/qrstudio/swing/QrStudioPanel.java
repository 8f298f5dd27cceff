package ca.weblite.qrstudio.swing;

import ca.weblite.qrstudio.EncodingMode;
import ca.weblite.qrstudio.ErrorCorrection;
import ca.weblite.qrstudio.GenerationRequest;
import ca.weblite.qrstudio.GenerationResult;
import ca.weblite.qrstudio.QrImages;
import ca.weblite.qrstudio.RasterImage;
import ca.weblite.qrstudio.RequestSubmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.BorderFactory;
import javax.swing.ImageIcon;
import javax.swing.JButton;
import javax.swing.JComboBox;
import javax.swing.JFileChooser;
import javax.swing.JLabel;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.JSpinner;
import javax.swing.JTextArea;
import javax.swing.SpinnerNumberModel;
import javax.swing.SwingConstants;
import javax.swing.event.DocumentEvent;
import javax.swing.event.DocumentListener;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.BorderLayout;
import java.awt.FlowLayout;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Editor panel: text and option controls, the rendered symbol, and a save button.
 *
 * <p>Every edit submits a fresh request to the {@link RequestSubmitter}. Results
 * come back through {@link #showResult(GenerationResult)}, which must be called on
 * the EDT (wrap it in a {@link SwingResultSink}).</p>
 */
public class QrStudioPanel extends JPanel {

    private static final Logger log = LoggerFactory.getLogger(QrStudioPanel.class);

    private final RequestSubmitter submitter;

    private final JTextArea textArea = new JTextArea(4, 40);
    private final JComboBox<ErrorCorrection> errorCorrectionBox = new JComboBox<>(ErrorCorrection.values());
    private final JSpinner versionSpinner = new JSpinner(new SpinnerNumberModel(
            GenerationRequest.AUTO_VERSION, GenerationRequest.AUTO_VERSION, GenerationRequest.MAX_VERSION, 1));
    private final JComboBox<EncodingMode> modeBox = new JComboBox<>(EncodingMode.values());
    private final JSpinner scaleSpinner = new JSpinner(new SpinnerNumberModel(
            GenerationRequest.DEFAULT_SCALE, GenerationRequest.MIN_SCALE, GenerationRequest.MAX_SCALE, 1));
    private final JLabel imageLabel = new JLabel("", SwingConstants.CENTER);
    private final JLabel statusLabel = new JLabel(" ");
    private final JButton saveButton = new JButton("Save PNG...");

    private RasterImage lastImage;
    private boolean updating;

    public QrStudioPanel(RequestSubmitter submitter) {
        super(new BorderLayout(8, 8));
        this.submitter = Objects.requireNonNull(submitter, "submitter must not be null");
        setBorder(BorderFactory.createEmptyBorder(8, 8, 8, 8));

        JPanel options = new JPanel(new FlowLayout(FlowLayout.LEFT));
        options.add(new JLabel("Error correction:"));
        options.add(errorCorrectionBox);
        options.add(new JLabel("Version (0 = auto):"));
        options.add(versionSpinner);
        options.add(new JLabel("Mode:"));
        options.add(modeBox);
        options.add(new JLabel("Scale:"));
        options.add(scaleSpinner);

        JPanel top = new JPanel(new BorderLayout(4, 4));
        textArea.setLineWrap(true);
        top.add(new JScrollPane(textArea), BorderLayout.CENTER);
        top.add(options, BorderLayout.SOUTH);

        JPanel bottom = new JPanel(new BorderLayout());
        bottom.add(statusLabel, BorderLayout.CENTER);
        bottom.add(saveButton, BorderLayout.EAST);

        add(top, BorderLayout.NORTH);
        add(new JScrollPane(imageLabel), BorderLayout.CENTER);
        add(bottom, BorderLayout.SOUTH);

        saveButton.setEnabled(false);
        saveButton.addActionListener(e -> chooseFileAndSave());

        textArea.getDocument().addDocumentListener(new DocumentListener() {
            @Override
            public void insertUpdate(DocumentEvent e) {
                inputChanged();
            }

            @Override
            public void removeUpdate(DocumentEvent e) {
                inputChanged();
            }

            @Override
            public void changedUpdate(DocumentEvent e) {
                inputChanged();
            }
        });
        errorCorrectionBox.addActionListener(e -> inputChanged());
        modeBox.addActionListener(e -> inputChanged());
        versionSpinner.addChangeListener(e -> inputChanged());
        scaleSpinner.addChangeListener(e -> inputChanged());
    }

    /**
     * Sets every control from {@code request} and submits it once.
     *
     * @param request the request to show
     */
    public void applyRequest(GenerationRequest request) {
        updating = true;
        try {
            textArea.setText(request.getText());
            errorCorrectionBox.setSelectedItem(request.getErrorCorrection());
            versionSpinner.setValue(request.getVersion());
            modeBox.setSelectedItem(request.getMode());
            scaleSpinner.setValue(request.getScale());
        } finally {
            updating = false;
        }
        submitter.submit(buildRequest());
    }

    /**
     * @return a request reflecting the current state of the controls
     */
    public GenerationRequest buildRequest() {
        return new GenerationRequest(
                textArea.getText(),
                (ErrorCorrection) errorCorrectionBox.getSelectedItem(),
                (Integer) versionSpinner.getValue(),
                (EncodingMode) modeBox.getSelectedItem(),
                (Integer) scaleSpinner.getValue());
    }

    /**
     * Shows a result: the image and an enabled save button on success, the
     * message and a disabled save button on failure.
     *
     * @param result the result to show
     */
    public void showResult(GenerationResult result) {
        if (result.isSuccess()) {
            RasterImage image = result.asSuccess().getImage();
            lastImage = image;
            imageLabel.setText(null);
            imageLabel.setIcon(new ImageIcon(QrImages.toBufferedImage(image)));
            statusLabel.setText(image.getWidth() + " x " + image.getHeight() + " px");
            saveButton.setEnabled(true);
        } else {
            lastImage = null;
            imageLabel.setIcon(null);
            imageLabel.setText(result.asFailure().getMessage());
            statusLabel.setText("Cannot encode");
            saveButton.setEnabled(false);
        }
    }

    /**
     * Writes the last successful image to {@code file}.
     *
     * @param file destination
     * @throws IOException if writing fails
     * @throws IllegalStateException if no image is showing
     */
    public void saveImage(Path file) throws IOException {
        RasterImage image = lastImage;
        if (image == null) {
            throw new IllegalStateException("No image to save");
        }
        QrImages.writePng(image, file);
        log.info("Saved QR image to {}", file);
    }

    void chooseFileAndSave() {
        JFileChooser chooser = new JFileChooser();
        chooser.setFileFilter(new FileNameExtensionFilter("PNG images", "png"));
        chooser.setSelectedFile(new File("qrcode.png"));
        if (chooser.showSaveDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }
        File file = chooser.getSelectedFile();
        if (!file.getName().toLowerCase(Locale.ROOT).endsWith(".png")) {
            file = new File(file.getParentFile(), file.getName() + ".png");
        }
        try {
            saveImage(file.toPath());
        } catch (IOException e) {
            log.warn("Could not save QR image", e);
            JOptionPane.showMessageDialog(this, e.getMessage(), "Save failed", JOptionPane.ERROR_MESSAGE);
        }
    }

    private void inputChanged() {
        if (!updating) {
            submitter.submit(buildRequest());
        }
    }

    boolean isSaveEnabled() {
        return saveButton.isEnabled();
    }

    RasterImage getLastImage() {
        return lastImage;
    }

    String getImageText() {
        return imageLabel.getText();
    }

    JTextArea getTextArea() {
        return textArea;
    }

    JComboBox<ErrorCorrection> getErrorCorrectionBox() {
        return errorCorrectionBox;
    }

    JSpinner getScaleSpinner() {
        return scaleSpinner;
    }
}
