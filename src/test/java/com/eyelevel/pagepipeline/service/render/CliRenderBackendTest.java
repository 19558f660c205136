package com.eyelevel.pagepipeline.service.render;

import com.eyelevel.pagepipeline.common.processexec.ProcessExecutor;
import com.eyelevel.pagepipeline.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.pagepipeline.service.render.RenderResult.FailureKind;
import com.eyelevel.pagepipeline.service.render.RenderResult.RenderFailure;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CliRenderBackend")
class CliRenderBackendTest {

    private static final Path PDF = Path.of("/data/book.pdf");

    @Mock
    private ProcessExecutor processExecutor;

    @TempDir
    Path tempRoot;

    @Test
    @DisplayName("probe succeeds when the version command runs, whatever its exit code")
    void probe_commandRuns_available() throws Exception {
        when(processExecutor.execute(eq(List.of("gs", "--version")), anyString(), eq(10L), eq("gs")))
                .thenReturn(new ProcessResult(1, "", ""));

        assertThat(backend(CliTool.GHOSTSCRIPT).probe()).isTrue();
    }

    @Test
    @DisplayName("probe fails when the executable cannot be started")
    void probe_missingExecutable_unavailable() throws Exception {
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenThrow(new IOException("Cannot run program \"pdftoppm\": error=2"));

        assertThat(backend(CliTool.POPPLER).probe()).isFalse();
    }

    @Test
    @DisplayName("a zero exit code with a PNG on disk yields the rendered image")
    void render_success_readsOutput() throws Exception {
        when(processExecutor.execute(anyList(), anyString(), eq(120L), eq("mutool"))).thenAnswer(invocation -> {
            List<String> command = invocation.getArgument(0);
            String output = command.get(command.indexOf("-o") + 1);
            ImageIO.write(new BufferedImage(30, 40, BufferedImage.TYPE_INT_RGB), "png", new File(output));
            return new ProcessResult(0, "", "");
        });

        RenderResult result = backend(CliTool.MUPDF).render(PDF, 4, 96);

        assertThat(result).isInstanceOf(RenderResult.Rendered.class);
        BufferedImage image = ((RenderResult.Rendered) result).image();
        assertThat(image.getWidth()).isEqualTo(30);
        assertThat(image.getHeight()).isEqualTo(40);
        assertThat(result.backend()).isEqualTo("mupdf");
    }

    @Test
    @DisplayName("the working directory is created below the temp root and removed afterwards")
    void render_workDirUnderTempRootIsRemoved() throws Exception {
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString())).thenAnswer(invocation -> {
            List<String> command = invocation.getArgument(0);
            Path output = Path.of(command.get(command.indexOf("-o") + 1));
            assertThat(output).startsWith(tempRoot);
            return new ProcessResult(0, "", "");
        });

        backend(CliTool.MUPDF).render(PDF, 1, 72);

        try (Stream<Path> entries = Files.list(tempRoot)) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    @DisplayName("the poppler command renders exactly the requested page at the requested DPI")
    @SuppressWarnings("unchecked")
    void render_popplerCommand() throws Exception {
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenReturn(new ProcessResult(0, "", ""));

        backend(CliTool.POPPLER).render(PDF, 7, 150);

        ArgumentCaptor<List<String>> captor = ArgumentCaptor.forClass(List.class);
        verify(processExecutor).execute(captor.capture(), anyString(), anyLong(), anyString());
        assertThat(captor.getValue()).startsWith("pdftoppm", "-png", "-r", "150", "-f", "7", "-l", "7",
                "-singlefile", "/data/book.pdf");
    }

    @Test
    @DisplayName("a non-zero exit code is a render error carrying stderr")
    void render_nonZeroExit_renderError() throws Exception {
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenReturn(new ProcessResult(1, "", "Syntax Error: broken xref"));

        RenderResult result = backend(CliTool.POPPLER).render(PDF, 1, 150);

        assertThat(result).isInstanceOf(RenderFailure.class);
        RenderFailure failure = (RenderFailure) result;
        assertThat(failure.kind()).isEqualTo(FailureKind.RENDER_ERROR);
        assertThat(failure.reason()).contains("broken xref");
    }

    @Test
    @DisplayName("a successful exit without an output file is a render error")
    void render_noOutput_renderError() throws Exception {
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenReturn(new ProcessResult(0, "", ""));

        RenderResult result = backend(CliTool.GHOSTSCRIPT).render(PDF, 1, 150);

        assertThat(((RenderFailure) result).kind()).isEqualTo(FailureKind.RENDER_ERROR);
    }

    @Test
    @DisplayName("an executable removed after startup reports UNAVAILABLE")
    void render_executableMissing_unavailable() throws Exception {
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenThrow(new IOException("Cannot run program \"mutool\": error=2, No such file or directory"));

        RenderResult result = backend(CliTool.MUPDF).render(PDF, 1, 150);

        assertThat(((RenderFailure) result).kind()).isEqualTo(FailureKind.UNAVAILABLE);
    }

    @Test
    @DisplayName("a timeout is a render error")
    void render_timeout_renderError() throws Exception {
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenThrow(new IOException("gs process timed out after 120 seconds."));

        RenderResult result = backend(CliTool.GHOSTSCRIPT).render(PDF, 1, 150);

        RenderFailure failure = (RenderFailure) result;
        assertThat(failure.kind()).isEqualTo(FailureKind.RENDER_ERROR);
        assertThat(failure.reason()).contains("timed out");
    }

    private CliRenderBackend backend(CliTool tool) {
        return new CliRenderBackend(tool, processExecutor, 120, 10, tempRoot);
    }
}
