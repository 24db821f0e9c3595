package com.fiberfit.main;

import com.fiberfit.model.AppConfig;
import com.fiberfit.service.ArtifactStore;
import com.fiberfit.service.FiberFitSession;
import com.fiberfit.service.FiberOrientationService;
import com.fiberfit.ui.AnalysisTab;
import com.fiberfit.ui.SettingsTab;
import javafx.application.Application;
import javafx.application.Platform;
import javafx.scene.Scene;
import javafx.scene.control.TabPane;
import javafx.stage.Stage;
import java.nio.file.Paths;

public class FiberFitApp extends Application {

    private FiberFitSession session;

    @Override
    public void start(Stage primaryStage) {
        primaryStage.setTitle("🧵 FiberFit");

        session = new FiberFitSession(new FiberOrientationService(),
                new ArtifactStore(Paths.get(AppConfig.getArtifactBaseDir())),
                Platform::runLater);

        TabPane tabPane = new TabPane();
        tabPane.getTabs().add(new AnalysisTab(session).create());   // 1. Analyze
        tabPane.getTabs().add(new SettingsTab().create());          // 2. Settings

        Scene scene = new Scene(tabPane, 900, 850);
        primaryStage.setScene(scene);
        primaryStage.show();
    }

    @Override
    public void stop() {
        // removes the temp folder with the rendered figures
        if (session != null) session.close();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
