package com.fiberfit.service;

import com.fiberfit.model.ErrorKind;
import nom.tam.fits.FitsException;

import javax.imageio.IIOException;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Maps whatever went wrong with one file to an {@link ErrorKind}. The first cause in the
 * chain with a specific meaning wins; everything else falls into
 * {@link ErrorKind#IMAGE_SHAPE_OR_OTHER}.
 */
public class ErrorClassifier {

    public ErrorKind classify(Throwable failure) {
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        for (Throwable t = failure; t != null && seen.put(t, Boolean.TRUE) == null; t = t.getCause()) {
            ErrorKind kind = classifyOne(t);
            if (kind != null) return kind;
        }
        return ErrorKind.IMAGE_SHAPE_OR_OTHER;
    }

    private ErrorKind classifyOne(Throwable t) {
        if (t instanceof UnsupportedImageException
                || t instanceof IIOException
                || t instanceof FitsException
                || t instanceof ClassCastException) {
            return ErrorKind.UNSUPPORTED_IMAGE;
        }
        if (t instanceof ArithmeticException) {
            return ErrorKind.SETTINGS_OUT_OF_DOMAIN;
        }
        if (t instanceof NonSquareImageException) {
            return ErrorKind.IMAGE_SHAPE_OR_OTHER;
        }
        return null;
    }
}
