package com.fiberfit.service;

import com.fiberfit.model.AnalysisOutput;
import com.fiberfit.model.AnalysisRequest;
import com.fiberfit.model.ArtifactKind;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Analysis stand-in: returns tiny gray images, or throws what was registered for a file name.
 */
class FakeAnalysisAdapter implements AnalysisAdapter {

    private final Map<String, Callable<Exception>> failures = new HashMap<>();
    final List<Path> calls = Collections.synchronizedList(new ArrayList<>());

    FakeAnalysisAdapter failWith(String fileName, Callable<Exception> failure) {
        failures.put(fileName, failure);
        return this;
    }

    @Override
    public AnalysisOutput analyze(AnalysisRequest request) throws Exception {
        calls.add(request.file());
        Callable<Exception> failure = failures.get(request.file().getFileName().toString());
        if (failure != null) throw failure.call();
        return output(calls.size());
    }

    static AnalysisOutput output(double k) {
        Map<ArtifactKind, BufferedImage> images = new EnumMap<>(ArtifactKind.class);
        for (ArtifactKind kind : ArtifactKind.values())
            images.put(kind, new BufferedImage(4, 4, BufferedImage.TYPE_BYTE_GRAY));
        return new AnalysisOutput(k, 10.0, 0.9, new double[]{5.0, 0.5}, images, 4, 4, 0.01);
    }
}
