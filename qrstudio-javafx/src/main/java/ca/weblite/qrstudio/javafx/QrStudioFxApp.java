package ca.weblite.qrstudio.javafx;

import ca.weblite.qrstudio.EncodingMode;
import ca.weblite.qrstudio.ErrorCorrection;
import ca.weblite.qrstudio.GenerationRequest;
import ca.weblite.qrstudio.GenerationResult;
import ca.weblite.qrstudio.QrGenerationPipeline;
import ca.weblite.qrstudio.QrImages;
import ca.weblite.qrstudio.QrStudio;
import ca.weblite.qrstudio.QrStudioConfig;
import ca.weblite.qrstudio.RasterImage;
import ca.weblite.qrstudio.RequestSubmitter;
import javafx.application.Application;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.Alert;
import javafx.scene.control.Button;
import javafx.scene.control.ComboBox;
import javafx.scene.control.Label;
import javafx.scene.control.Menu;
import javafx.scene.control.MenuBar;
import javafx.scene.control.MenuItem;
import javafx.scene.control.ScrollPane;
import javafx.scene.control.Spinner;
import javafx.scene.control.TextArea;
import javafx.scene.image.ImageView;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.StackPane;
import javafx.scene.layout.VBox;
import javafx.stage.FileChooser;
import javafx.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Objects;

/**
 * JavaFX front end.
 *
 * <p>Launch through {@link QrStudioFxLauncher} when JavaFX is on the class path
 * rather than the module path.</p>
 */
public class QrStudioFxApp extends Application {

    private static final Logger log = LoggerFactory.getLogger(QrStudioFxApp.class);

    private QrGenerationPipeline pipeline;

    public static void main(String[] args) {
        launch(args);
    }

    @Override
    public void start(Stage stage) {
        QrStudioConfig config = QrStudioConfig.fromSystemProperties();
        Editor[] editor = new Editor[1];
        // results are posted to the FX thread, so editor[0] is set before the first one runs
        pipeline = config.createPipeline(new FxResultSink(result -> editor[0].showResult(result)));
        editor[0] = new Editor(pipeline, stage);

        BorderPane root = new BorderPane();
        root.setTop(createMenuBar(stage, editor[0]));
        root.setCenter(editor[0].getNode());

        stage.setTitle(QrStudio.APP_NAME);
        stage.setScene(new Scene(root, 720, 760));

        pipeline.start();
        editor[0].applyRequest(config.getInitialRequest());
        stage.show();
        log.info("{} {} started", QrStudio.APP_NAME, QrStudio.getVersion());
    }

    @Override
    public void stop() {
        if (pipeline != null) {
            pipeline.shutdown();
        }
    }

    private static MenuBar createMenuBar(Stage stage, Editor editor) {
        MenuItem save = new MenuItem("Save PNG...");
        save.disableProperty().bind(editor.saveButton.disableProperty());
        save.setOnAction(e -> editor.chooseFileAndSave());
        MenuItem quit = new MenuItem("Quit");
        quit.setOnAction(e -> stage.close());
        Menu file = new Menu("File");
        file.getItems().addAll(save, quit);

        MenuItem about = new MenuItem("About " + QrStudio.APP_NAME);
        about.setOnAction(e -> {
            Alert alert = new Alert(Alert.AlertType.INFORMATION);
            alert.setTitle("About");
            alert.setHeaderText(QrStudio.APP_NAME + " " + QrStudio.getVersion());
            alert.setContentText("Live QR code generator");
            alert.showAndWait();
        });
        Menu help = new Menu("Help");
        help.getItems().add(about);

        return new MenuBar(file, help);
    }

    /**
     * The editor controls and image view. Must be used on the FX Application Thread.
     */
    static final class Editor {
        private final RequestSubmitter submitter;
        private final Stage owner;

        final TextArea textArea = new TextArea();
        final ComboBox<ErrorCorrection> errorCorrectionBox = new ComboBox<>();
        final Spinner<Integer> versionSpinner = new Spinner<>(
                GenerationRequest.AUTO_VERSION, GenerationRequest.MAX_VERSION, GenerationRequest.AUTO_VERSION);
        final ComboBox<EncodingMode> modeBox = new ComboBox<>();
        final Spinner<Integer> scaleSpinner = new Spinner<>(
                GenerationRequest.MIN_SCALE, GenerationRequest.MAX_SCALE, GenerationRequest.DEFAULT_SCALE);
        final ImageView imageView = new ImageView();
        final Label messageLabel = new Label();
        final Label statusLabel = new Label(" ");
        final Button saveButton = new Button("Save PNG...");

        private final VBox node;
        private RasterImage lastImage;
        private boolean updating;

        Editor(RequestSubmitter submitter, Stage owner) {
            this.submitter = Objects.requireNonNull(submitter, "submitter must not be null");
            this.owner = owner;

            errorCorrectionBox.getItems().addAll(ErrorCorrection.values());
            modeBox.getItems().addAll(EncodingMode.values());
            textArea.setWrapText(true);
            textArea.setPrefRowCount(4);
            saveButton.setDisable(true);
            saveButton.setOnAction(e -> chooseFileAndSave());

            HBox options = new HBox(8,
                    new Label("Error correction:"), errorCorrectionBox,
                    new Label("Version (0 = auto):"), versionSpinner,
                    new Label("Mode:"), modeBox,
                    new Label("Scale:"), scaleSpinner);
            options.setAlignment(Pos.CENTER_LEFT);

            StackPane imagePane = new StackPane(imageView, messageLabel);
            ScrollPane scroller = new ScrollPane(imagePane);
            scroller.setFitToWidth(true);
            scroller.setFitToHeight(true);
            VBox.setVgrow(scroller, Priority.ALWAYS);

            HBox bottom = new HBox(8, statusLabel, saveButton);
            HBox.setHgrow(statusLabel, Priority.ALWAYS);
            statusLabel.setMaxWidth(Double.MAX_VALUE);
            bottom.setAlignment(Pos.CENTER_RIGHT);

            node = new VBox(8, textArea, options, scroller, bottom);
            node.setPadding(new Insets(8));

            textArea.textProperty().addListener((obs, oldValue, newValue) -> inputChanged());
            errorCorrectionBox.valueProperty().addListener((obs, oldValue, newValue) -> inputChanged());
            modeBox.valueProperty().addListener((obs, oldValue, newValue) -> inputChanged());
            versionSpinner.valueProperty().addListener((obs, oldValue, newValue) -> inputChanged());
            scaleSpinner.valueProperty().addListener((obs, oldValue, newValue) -> inputChanged());
        }

        VBox getNode() {
            return node;
        }

        void applyRequest(GenerationRequest request) {
            updating = true;
            try {
                textArea.setText(request.getText());
                errorCorrectionBox.setValue(request.getErrorCorrection());
                versionSpinner.getValueFactory().setValue(request.getVersion());
                modeBox.setValue(request.getMode());
                scaleSpinner.getValueFactory().setValue(request.getScale());
            } finally {
                updating = false;
            }
            submitter.submit(buildRequest());
        }

        GenerationRequest buildRequest() {
            return new GenerationRequest(textArea.getText(), errorCorrectionBox.getValue(),
                    versionSpinner.getValue(), modeBox.getValue(), scaleSpinner.getValue());
        }

        void showResult(GenerationResult result) {
            if (result.isSuccess()) {
                RasterImage image = result.asSuccess().getImage();
                lastImage = image;
                imageView.setImage(FxImages.toFxImage(image));
                messageLabel.setText("");
                statusLabel.setText(image.getWidth() + " x " + image.getHeight() + " px");
                saveButton.setDisable(false);
            } else {
                lastImage = null;
                imageView.setImage(null);
                messageLabel.setText(result.asFailure().getMessage());
                statusLabel.setText("Cannot encode");
                saveButton.setDisable(true);
            }
        }

        RasterImage getLastImage() {
            return lastImage;
        }

        void chooseFileAndSave() {
            RasterImage image = lastImage;
            if (image == null) {
                return;
            }
            FileChooser chooser = new FileChooser();
            chooser.getExtensionFilters().add(new FileChooser.ExtensionFilter("PNG images", "*.png"));
            chooser.setInitialFileName("qrcode.png");
            File file = chooser.showSaveDialog(owner);
            if (file == null) {
                return;
            }
            try {
                QrImages.writePng(image, file.toPath());
                log.info("Saved QR image to {}", file);
            } catch (IOException e) {
                log.warn("Could not save QR image", e);
                Alert alert = new Alert(Alert.AlertType.ERROR, e.getMessage());
                alert.setHeaderText("Save failed");
                alert.showAndWait();
            }
        }

        private void inputChanged() {
            if (!updating && errorCorrectionBox.getValue() != null && modeBox.getValue() != null) {
                submitter.submit(buildRequest());
            }
        }
    }
}
