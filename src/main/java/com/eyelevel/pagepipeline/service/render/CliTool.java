package com.eyelevel.pagepipeline.service.render;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line rasterizers the {@link CliRenderBackend} knows how to drive. Each tool writes a
 * single PNG for the requested page into {@code output}.
 */
public enum CliTool {
    POPPLER("pdftoppm", "-v") {
        @Override
        List<String> renderCommand(Path pdf, int pageNumber, int dpi, Path output) {
            String page = String.valueOf(pageNumber);
            String prefix = output.toString().replaceFirst("\\.png$", "");
            return List.of(executable, "-png", "-r", String.valueOf(dpi), "-f", page, "-l", page, "-singlefile",
                    pdf.toString(), prefix);
        }
    },
    MUPDF("mutool", "-v") {
        @Override
        List<String> renderCommand(Path pdf, int pageNumber, int dpi, Path output) {
            return List.of(executable, "draw", "-q", "-r", String.valueOf(dpi), "-o", output.toString(),
                    pdf.toString(), String.valueOf(pageNumber));
        }
    },
    GHOSTSCRIPT("gs", "--version") {
        @Override
        List<String> renderCommand(Path pdf, int pageNumber, int dpi, Path output) {
            return List.of(executable, "-dSAFER", "-dBATCH", "-dNOPAUSE", "-dQUIET", "-sDEVICE=png16m",
                    "-r" + dpi, "-dFirstPage=" + pageNumber, "-dLastPage=" + pageNumber,
                    "-sOutputFile=" + output, pdf.toString());
        }
    };

    final String executable;
    private final String versionFlag;

    CliTool(String executable, String versionFlag) {
        this.executable = executable;
        this.versionFlag = versionFlag;
    }

    public String executable() {
        return executable;
    }

    List<String> probeCommand() {
        return List.of(executable, versionFlag);
    }

    abstract List<String> renderCommand(Path pdf, int pageNumber, int dpi, Path output);
}
