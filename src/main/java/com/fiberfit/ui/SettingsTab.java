package com.fiberfit.ui;

import com.fiberfit.model.AnalysisSettings;
import com.fiberfit.model.AppConfig;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import javafx.stage.DirectoryChooser;
import java.io.File;
import java.util.Locale;

public class SettingsTab {

    private TextField txtUpperCut, txtLowerCut, txtAngleInc, txtRadialStep;
    private TextField txtArtifactDir;
    private Label lblResults;

    public Tab create() {
        Tab tab = new Tab("⚙️ Settings");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(20));

        VBox content = new VBox(20);
        content.setAlignment(Pos.TOP_CENTER);
        content.setMaxWidth(600);

        Label title = new Label("🔬 Analysis Settings");
        title.setFont(Font.font("System", FontWeight.BOLD, 20));

        // --- 1. SPECTRUM PARAMETERS ---
        GridPane grid = new GridPane();
        grid.setHgap(15); grid.setVgap(15);
        grid.setStyle("-fx-border-color: #CCC; -fx-padding: 15; -fx-background-color: #F9F9F9; -fx-background-radius: 5;");

        txtUpperCut = new TextField(format(AppConfig.getUpperCut()));
        txtLowerCut = new TextField(format(AppConfig.getLowerCut()));
        txtAngleInc = new TextField(format(AppConfig.getAngleIncrement()));
        txtRadialStep = new TextField(format(AppConfig.getRadialStep()));

        grid.add(new Label("Upper cut-off (px):"), 0, 0); grid.add(txtUpperCut, 1, 0);
        grid.add(new Label("Lower cut-off (px):"), 0, 1); grid.add(txtLowerCut, 1, 1);
        grid.add(new Label("Angle increment (°):"), 0, 2); grid.add(txtAngleInc, 1, 2);
        grid.add(new Label("Radial step (px):"), 0, 3); grid.add(txtRadialStep, 1, 3);

        // --- 2. ARTIFACT LOCATION ---
        HBox dirBox = new HBox(10);
        dirBox.setAlignment(Pos.CENTER_LEFT);
        txtArtifactDir = new TextField(AppConfig.getArtifactBaseDir());
        txtArtifactDir.setPrefWidth(300);
        Button btnBrowse = new Button("📂");
        btnBrowse.setOnAction(e -> browseDir(txtArtifactDir));
        dirBox.getChildren().addAll(new Label("Temp folder:"), txtArtifactDir, btnBrowse);
        Label lblDirInfo = new Label("Used from the next session on.");
        lblDirInfo.setStyle("-fx-font-size: 10px; -fx-text-fill: #666;");

        // --- FOOTER ---
        Button btnDefaults = new Button("↩ Defaults");
        btnDefaults.setOnAction(e -> fill(AnalysisSettings.defaults()));

        Button btnSave = new Button("💾 Save");
        btnSave.setStyle("-fx-base: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold; -fx-font-size: 14px;");
        btnSave.setMaxWidth(Double.MAX_VALUE);
        btnSave.setOnAction(e -> saveAllConfig());

        lblResults = new Label("");
        lblResults.setStyle("-fx-font-weight: bold;");

        content.getChildren().addAll(title, grid, new VBox(5, dirBox, lblDirInfo), new HBox(10, btnDefaults), btnSave, lblResults);

        ScrollPane scroll = new ScrollPane(content);
        scroll.setFitToWidth(true);
        scroll.setStyle("-fx-background-color:transparent;");

        root.setCenter(scroll);
        tab.setContent(root);
        return tab;
    }

    private static String format(double v) {
        return String.format(Locale.US, "%.2f", v);
    }

    private void fill(AnalysisSettings s) {
        txtUpperCut.setText(format(s.upperCut));
        txtLowerCut.setText(format(s.lowerCut));
        txtAngleInc.setText(format(s.angleIncrement));
        txtRadialStep.setText(format(s.radialStep));
    }

    private void browseDir(TextField tf) {
        DirectoryChooser dc = new DirectoryChooser();
        File f = dc.showDialog(tf.getScene().getWindow());
        if (f != null) tf.setText(f.getAbsolutePath());
    }

    private void saveAllConfig() {
        AnalysisSettings s;
        try {
            s = new AnalysisSettings(
                    Double.parseDouble(txtUpperCut.getText().trim()),
                    Double.parseDouble(txtLowerCut.getText().trim()),
                    Double.parseDouble(txtAngleInc.getText().trim()),
                    Double.parseDouble(txtRadialStep.getText().trim()));
        } catch (IllegalArgumentException e) {
            lblResults.setText("❌ Invalid number");
            lblResults.setStyle("-fx-font-weight: bold; -fx-text-fill: #C62828;");
            return;
        }
        AppConfig.setSettings(s);
        AppConfig.setArtifactBaseDir(txtArtifactDir.getText().trim());
        lblResults.setText("✅ Settings saved (" + s + ")");
        lblResults.setStyle("-fx-font-weight: bold; -fx-text-fill: #2E7D32;");
    }
}
