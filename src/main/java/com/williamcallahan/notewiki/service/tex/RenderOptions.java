package com.williamcallahan.notewiki.service.tex;

import java.util.Objects;

/**
 * Settings the rendering core reads; built from application properties by the service layer.
 *
 * @param pdfBasePath prefix for links to PDF files, e.g. {@code ../pdfs/}
 * @param tikzPreamble TikZ source prepended to diagrams that need the shared libraries
 */
public record RenderOptions(String pdfBasePath, String tikzPreamble) {

    public static final String DEFAULT_PDF_BASE_PATH = "../pdfs/";
    public static final String DEFAULT_TIKZ_PREAMBLE =
        "\\usetikzlibrary{arrows.meta,calc,decorations.markings,shapes.geometric,patterns,positioning,fit}";

    public RenderOptions {
        Objects.requireNonNull(pdfBasePath, "PDF base path cannot be null");
        tikzPreamble = tikzPreamble == null ? "" : tikzPreamble;
    }

    public static RenderOptions defaults() {
        return new RenderOptions(DEFAULT_PDF_BASE_PATH, DEFAULT_TIKZ_PREAMBLE);
    }
}
