package ca.weblite.qrstudio.swing;

import ca.weblite.qrstudio.EncodingMode;
import ca.weblite.qrstudio.ErrorCorrection;
import ca.weblite.qrstudio.GenerationRequest;
import ca.weblite.qrstudio.GenerationResult;
import ca.weblite.qrstudio.RasterImage;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import javax.imageio.ImageIO;
import javax.swing.SpinnerNumberModel;
import javax.swing.SwingUtilities;
import java.awt.image.BufferedImage;
import java.io.File;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public class QrStudioPanelTest {

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    private List<GenerationRequest> submitted;
    private QrStudioPanel panel;

    @Before
    public void setUp() throws Exception {
        submitted = new CopyOnWriteArrayList<>();
        AtomicReference<QrStudioPanel> created = new AtomicReference<>();
        SwingUtilities.invokeAndWait(() -> created.set(new QrStudioPanel(submitted::add)));
        panel = created.get();
    }

    private static RasterImage image() {
        return new RasterImage(2, 1, new byte[]{RasterImage.DARK, RasterImage.LIGHT});
    }

    private GenerationRequest last() {
        return submitted.get(submitted.size() - 1);
    }

    @Test
    public void testApplyRequestSetsControlsAndSubmitsOnce() throws Exception {
        GenerationRequest request = new GenerationRequest("HELLO", ErrorCorrection.HIGH, 3, EncodingMode.ALPHANUMERIC, 5);

        SwingUtilities.invokeAndWait(() -> panel.applyRequest(request));

        assertEquals(1, submitted.size());
        assertEquals(request, submitted.get(0));
        assertEquals(request, panel.buildRequest());
    }

    @Test
    public void testEditingTextSubmitsNewRequest() throws Exception {
        SwingUtilities.invokeAndWait(() -> panel.getTextArea().setText("typed"));

        assertFalse(submitted.isEmpty());
        assertEquals("typed", last().getText());
    }

    @Test
    public void testChangingOptionsSubmitsNewRequest() throws Exception {
        SwingUtilities.invokeAndWait(() -> {
            panel.getErrorCorrectionBox().setSelectedItem(ErrorCorrection.QUARTILE);
            panel.getScaleSpinner().setValue(12);
        });

        assertEquals(ErrorCorrection.QUARTILE, last().getErrorCorrection());
        assertEquals(12, last().getScale());
    }

    @Test
    public void testScaleSpinnerMatchesRequestBounds() throws Exception {
        SpinnerNumberModel model = (SpinnerNumberModel) panel.getScaleSpinner().getModel();
        assertEquals(GenerationRequest.MIN_SCALE, model.getMinimum());
        assertEquals(GenerationRequest.MAX_SCALE, model.getMaximum());

        SwingUtilities.invokeAndWait(() -> panel.applyRequest(GenerationRequest.of("a").withScale(GenerationRequest.MAX_SCALE)));

        assertEquals(GenerationRequest.MAX_SCALE, last().getScale());
    }

    @Test
    public void testSuccessEnablesSave() throws Exception {
        SwingUtilities.invokeAndWait(() ->
                panel.showResult(GenerationResult.success(GenerationRequest.of("a"), image(), "dump")));

        assertTrue(panel.isSaveEnabled());
        assertEquals(image(), panel.getLastImage());
    }

    @Test
    public void testFailureShowsMessageAndDisablesSave() throws Exception {
        SwingUtilities.invokeAndWait(() -> {
            panel.showResult(GenerationResult.success(GenerationRequest.of("a"), image(), "dump"));
            panel.showResult(GenerationResult.failure(GenerationRequest.of("b"), "Text is too long"));
        });

        assertFalse(panel.isSaveEnabled());
        assertNull(panel.getLastImage());
        assertEquals("Text is too long", panel.getImageText());
    }

    @Test
    public void testSaveImageWritesPng() throws Exception {
        SwingUtilities.invokeAndWait(() ->
                panel.showResult(GenerationResult.success(GenerationRequest.of("a"), image(), "dump")));
        File file = new File(tempFolder.getRoot(), "out.png");

        panel.saveImage(file.toPath());

        BufferedImage read = ImageIO.read(file);
        assertEquals(2, read.getWidth());
        assertEquals(1, read.getHeight());
    }

    @Test(expected = IllegalStateException.class)
    public void testSaveWithoutImageFails() throws Exception {
        panel.saveImage(new File(tempFolder.getRoot(), "none.png").toPath());
    }
}
