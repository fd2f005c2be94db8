package com.williamcallahan.notewiki.config;

import com.williamcallahan.notewiki.service.tex.RenderOptions;

import java.util.Locale;

/**
 * Full-page assembly settings: site name, script locations and link prefixes.
 */
public class PageSettings {

    private static final String SITE_NAME_DEF = "Notes";
    private static final String MATHJAX_URL_DEF = "https://cdn.jsdelivr.net/npm/mathjax@3/es5/tex-chtml-full.js";
    private static final String TIKZJAX_URL_DEF = "https://tikzjax.com/v1/tikzjax.js";
    private static final String TIKZJAX_CSS_DEF = "https://tikzjax.com/v1/fonts.css";
    private static final int TOC_THRESHOLD_DEF = 2;
    private static final String SITE_NAME_KEY = "app.page.site-name";
    private static final String PDF_BASE_KEY = "app.page.pdf-base-path";
    private static final String MATHJAX_URL_KEY = "app.page.mathjax-url";
    private static final String TIKZJAX_URL_KEY = "app.page.tikzjax-url";
    private static final String TOC_THRESHOLD_KEY = "app.page.toc-threshold";
    private static final String BLANK_FMT = "%s must not be blank.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private String siteName = SITE_NAME_DEF;
    private String pdfBasePath = RenderOptions.DEFAULT_PDF_BASE_PATH;
    private String mathjaxUrl = MATHJAX_URL_DEF;
    private String tikzjaxUrl = TIKZJAX_URL_DEF;
    private String tikzjaxStylesheetUrl = TIKZJAX_CSS_DEF;
    private String tikzPreamble = RenderOptions.DEFAULT_TIKZ_PREAMBLE;
    private int tocThreshold = TOC_THRESHOLD_DEF;

    /**
     * Creates page settings with defaults.
     */
    public PageSettings() {}

    /**
     * Validates page settings.
     */
    public void validateConfiguration() {
        requireText(SITE_NAME_KEY, siteName);
        requireText(MATHJAX_URL_KEY, mathjaxUrl);
        requireText(TIKZJAX_URL_KEY, tikzjaxUrl);
        if (pdfBasePath == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_FMT, PDF_BASE_KEY));
        }
        if (tocThreshold < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, TOC_THRESHOLD_KEY));
        }
    }

    /**
     * Builds the options the rendering core reads.
     *
     * @return render options carrying the PDF prefix and TikZ preamble
     */
    public RenderOptions toRenderOptions() {
        return new RenderOptions(pdfBasePath, tikzPreamble);
    }

    public String getSiteName() {
        return siteName;
    }

    public void setSiteName(String siteName) {
        this.siteName = siteName;
    }

    public String getPdfBasePath() {
        return pdfBasePath;
    }

    public void setPdfBasePath(String pdfBasePath) {
        this.pdfBasePath = pdfBasePath;
    }

    public String getMathjaxUrl() {
        return mathjaxUrl;
    }

    public void setMathjaxUrl(String mathjaxUrl) {
        this.mathjaxUrl = mathjaxUrl;
    }

    public String getTikzjaxUrl() {
        return tikzjaxUrl;
    }

    public void setTikzjaxUrl(String tikzjaxUrl) {
        this.tikzjaxUrl = tikzjaxUrl;
    }

    public String getTikzjaxStylesheetUrl() {
        return tikzjaxStylesheetUrl;
    }

    public void setTikzjaxStylesheetUrl(String tikzjaxStylesheetUrl) {
        this.tikzjaxStylesheetUrl = tikzjaxStylesheetUrl;
    }

    public String getTikzPreamble() {
        return tikzPreamble;
    }

    public void setTikzPreamble(String tikzPreamble) {
        this.tikzPreamble = tikzPreamble;
    }

    /**
     * Returns the number of level-2 headings needed before a table of contents is shown.
     *
     * @return table of contents threshold
     */
    public int getTocThreshold() {
        return tocThreshold;
    }

    public void setTocThreshold(int tocThreshold) {
        this.tocThreshold = tocThreshold;
    }

    private void requireText(String propertyKey, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_FMT, propertyKey));
        }
    }
}
