package com.fiberfit.service;

import com.fiberfit.model.AnalysisSettings;
import com.fiberfit.model.ProcessedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * CSV summary of processed results, one row per result in store order.
 */
public class ResultReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(ResultReportWriter.class);

    static final String HEADER = "file,timestamp,k,mu,R2,sigma,upper_cut,lower_cut,angle_increment,radial_step,sequence";

    public void write(Path target, List<ProcessedResult> results) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            out.write(HEADER);
            out.newLine();
            for (ProcessedResult r : results) {
                out.write(row(r));
                out.newLine();
            }
        }
        logger.info("Report with {} result(s) written to {}", results.size(), target);
    }

    String row(ProcessedResult r) {
        AnalysisSettings s = r.settings;
        return String.format(Locale.US, "%s,%s,%.4f,%.4f,%.4f,%.4f,%.2f,%.2f,%.2f,%.2f,%d",
                quote(r.source.getFileName().toString()), quote(r.timestamp()),
                r.k, r.th, r.r2, r.sigma(),
                s.upperCut, s.lowerCut, s.angleIncrement, s.radialStep,
                r.sequenceNumber);
    }

    private static String quote(String v) {
        if (v.indexOf(',') < 0 && v.indexOf('"') < 0 && v.indexOf('\n') < 0 && v.indexOf('\r') < 0) return v;
        return '"' + v.replace("\"", "\"\"") + '"';
    }
}
