package com.fiberfit.ui;

import com.fiberfit.model.AppConfig;
import com.fiberfit.model.ArtifactKind;
import com.fiberfit.model.BatchEvent;
import com.fiberfit.model.DisplayGeometry;
import com.fiberfit.model.ProcessedResult;
import com.fiberfit.service.FiberFitSession;
import com.fiberfit.service.ResultReportWriter;
import com.fiberfit.service.SessionListener;
import javafx.animation.PauseTransition;
import javafx.geometry.Insets;
import javafx.geometry.Orientation;
import javafx.geometry.Pos;
import javafx.geometry.Rectangle2D;
import javafx.scene.control.*;
import javafx.scene.image.Image;
import javafx.scene.image.ImageView;
import javafx.scene.layout.*;
import javafx.stage.FileChooser;
import javafx.stage.Screen;
import javafx.util.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class AnalysisTab implements SessionListener {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisTab.class);

    private final FiberFitSession session;
    private final ResultReportWriter reportWriter = new ResultReportWriter();

    // UI Controls
    private Button btnLoad, btnPrev, btnNext, btnClear, btnExport;
    private ComboBox<String> cmbImages;
    private Label lblK, lblMu, lblR2, lblSig;
    private ProgressBar progressBar;
    private final Map<ArtifactKind, ImageView> views = new EnumMap<>(ArtifactKind.class);

    // set while the combo box is refilled so its action handler ignores the change
    private boolean updatingCombo = false;

    public AnalysisTab(FiberFitSession session) {
        this.session = session;
        session.addListener(this);
    }

    public Tab create() {
        Tab tab = new Tab("🧵 FiberFit");
        tab.setClosable(false);
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(15));

        // --- TOOLBAR ---
        btnLoad = new Button("📂 Load");
        btnLoad.setStyle("-fx-base: #2196F3; -fx-text-fill: white; -fx-font-weight: bold;");
        btnLoad.setOnAction(e -> launch(root));
        btnPrev = new Button("◀");
        btnPrev.setOnAction(e -> session.getNavigation().retreat().ifPresent(this::showCurrent));
        btnNext = new Button("▶");
        btnNext.setOnAction(e -> session.getNavigation().advance().ifPresent(this::showCurrent));
        cmbImages = new ComboBox<>();
        cmbImages.setPrefWidth(200);
        cmbImages.setOnAction(e -> {
            if (updatingCombo || cmbImages.getValue() == null) return;
            session.getNavigation().selectByDisplayName(cmbImages.getValue()).ifPresent(this::showCurrent);
        });
        btnClear = new Button("🗑 Clear");
        btnClear.setOnAction(e -> clear());
        btnExport = new Button("📄 Export");
        btnExport.setOnAction(e -> export(root));

        HBox toolbar = new HBox(10, btnLoad, btnPrev, cmbImages, btnNext, new Separator(Orientation.VERTICAL), btnClear, btnExport);
        toolbar.setAlignment(Pos.CENTER_LEFT);

        // --- COEFFICIENTS ---
        lblK = new Label(); lblMu = new Label(); lblR2 = new Label(); lblSig = new Label();
        HBox coeffBox = new HBox(30, lblK, lblMu, lblR2, lblSig);
        coeffBox.setAlignment(Pos.CENTER);
        coeffBox.setStyle("-fx-font-size: 14px; -fx-font-weight: bold; -fx-padding: 8;");
        resetLabels();

        // --- FIGURES ---
        GridPane figures = new GridPane();
        figures.setHgap(10); figures.setVgap(10);
        figures.setAlignment(Pos.CENTER);
        int i = 0;
        for (ArtifactKind kind : ArtifactKind.values()) {
            ImageView view = new ImageView();
            view.setPreserveRatio(true);
            view.setFitWidth(300); view.setFitHeight(300);
            StackPane cell = new StackPane(view);
            cell.setStyle("-fx-border-color: #DDD; -fx-background-color: #FAFAFA;");
            cell.setPrefSize(310, 310);
            Tooltip.install(cell, new Tooltip(kind.caption()));
            figures.add(cell, i % 2, i / 2);
            views.put(kind, view);
            i++;
        }

        progressBar = new ProgressBar(0);
        progressBar.setMaxWidth(Double.MAX_VALUE);
        progressBar.setVisible(false);

        root.setTop(new VBox(10, toolbar, coeffBox));
        root.setCenter(figures);
        root.setBottom(progressBar);
        updateButtons();
        tab.setContent(root);
        return tab;
    }

    private void launch(Pane root) {
        FileChooser fc = new FileChooser();
        fc.getExtensionFilters().addAll(
                new FileChooser.ExtensionFilter("Images", "*.png", "*.tif", "*.tiff", "*.gif", "*.bmp", "*.jpg", "*.fits", "*.fit"),
                new FileChooser.ExtensionFilter("All files", "*.*"));
        List<File> chosen = fc.showOpenMultipleDialog(root.getScene().getWindow());
        if (chosen == null || chosen.isEmpty()) return;

        List<Path> files = new ArrayList<>();
        for (File f : chosen) files.add(f.toPath());
        try {
            session.launch(files, AppConfig.getSettings(), geometry());
        } catch (IllegalStateException e) {
            new Alert(Alert.AlertType.INFORMATION, "Please wait until the current images are analyzed.").show();
        } catch (IOException e) {
            logger.error("Unable to start analysis", e);
            new Alert(Alert.AlertType.ERROR, "Unable to create the temporary folder:\n" + e.getMessage()).show();
        }
        updateButtons();
    }

    private DisplayGeometry geometry() {
        Screen screen = Screen.getPrimary();
        Rectangle2D bounds = screen.getVisualBounds();
        return new DisplayGeometry(bounds.getWidth(), bounds.getHeight(), screen.getDpi());
    }

    private void clear() {
        try {
            session.clear();
        } catch (IllegalStateException e) {
            new Alert(Alert.AlertType.INFORMATION, "Please wait until the current images are analyzed.").show();
        } catch (IOException e) {
            logger.error("Unable to clear session", e);
            new Alert(Alert.AlertType.ERROR, "Unable to remove temporary files:\n" + e.getMessage()).show();
        }
    }

    private void export(Pane root) {
        if (!session.isStarted()) return;
        FileChooser fc = new FileChooser();
        fc.setInitialFileName("fiberfit-report.csv");
        fc.getExtensionFilters().add(new FileChooser.ExtensionFilter("CSV", "*.csv"));
        File f = fc.showSaveDialog(root.getScene().getWindow());
        if (f == null) return;
        try {
            reportWriter.write(f.toPath(), session.getResults().asList());
        } catch (IOException e) {
            logger.error("Unable to write report {}", f, e);
            new Alert(Alert.AlertType.ERROR, "Unable to write report:\n" + e.getMessage()).show();
        }
    }

    // --- SESSION CALLBACKS (FX thread) ---
    @Override
    public void onBatchStarted(int total) {
        progressBar.setProgress(0);
        progressBar.setVisible(true);
        updateButtons();
    }

    @Override
    public void onProgress(int processed, int total) {
        progressBar.setProgress(total > 0 ? (double) processed / total : 0);
    }

    @Override
    public void onResultSelected(ProcessedResult result, int index) {
        refreshCombo();
        showCurrent(result);
        updateButtons();
    }

    @Override
    public void onFailure(BatchEvent.ItemFailed failure) {
        progressBar.setVisible(false);
        Alert alert = new Alert(Alert.AlertType.ERROR, failure.message());
        alert.setHeaderText(null);
        alert.show();
    }

    @Override
    public void onBatchFinished(BatchEvent.Completed completed) {
        PauseTransition grace = new PauseTransition(Duration.millis(500));
        grace.setOnFinished(e -> {
            if (!session.isRunning()) progressBar.setVisible(false);
            updateButtons();
        });
        grace.play();
    }

    @Override
    public void onCleared() {
        resetLabels();
        for (ImageView v : views.values()) v.setImage(null);
        updatingCombo = true;
        cmbImages.getItems().clear();
        updatingCombo = false;
        progressBar.setVisible(false);
        updateButtons();
    }

    private void refreshCombo() {
        updatingCombo = true;
        cmbImages.getItems().setAll(session.getResults().displayNames());
        cmbImages.getSelectionModel().select(session.getNavigation().getIndex());
        updatingCombo = false;
    }

    private void showCurrent(ProcessedResult r) {
        lblK.setText("k = " + round(r.k));
        lblMu.setText("μ = " + round(r.th));
        lblR2.setText("R² = " + round(r.r2));
        lblSig.setText("σ = " + round(r.sigma()));
        for (ArtifactKind kind : ArtifactKind.values()) {
            Path p = session.getArtifactStore().artifactPath(kind, r.sequenceNumber);
            views.get(kind).setImage(new Image(p.toUri().toString(), 300, 400, true, true));
        }
        updatingCombo = true;
        cmbImages.getSelectionModel().select(session.getNavigation().getIndex());
        updatingCombo = false;
    }

    private void resetLabels() {
        lblK.setText("k = ");
        lblMu.setText("μ = ");
        lblR2.setText("R² = ");
        lblSig.setText("σ = ");
    }

    private void updateButtons() {
        boolean started = session.isStarted();
        btnPrev.setDisable(!started);
        btnNext.setDisable(!started);
        btnExport.setDisable(!started);
        btnClear.setDisable(!started || session.isRunning());
    }

    private static String round(double v) {
        return String.format(Locale.US, "%.2f", v);
    }
}
