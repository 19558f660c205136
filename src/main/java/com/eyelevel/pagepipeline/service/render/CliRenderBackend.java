package com.eyelevel.pagepipeline.service.render;

import com.eyelevel.pagepipeline.common.processexec.ProcessExecutor;
import com.eyelevel.pagepipeline.common.processexec.ProcessExecutor.ProcessResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders pages by shelling out to an installed rasterizer. Output goes to a private directory
 * below the configured temp root that is removed after every call.
 */
@Slf4j
public class CliRenderBackend implements RenderBackend {

    private final CliTool tool;
    private final ProcessExecutor processExecutor;
    private final long timeoutSeconds;
    private final long probeTimeoutSeconds;
    private final Path tempRoot;

    public CliRenderBackend(CliTool tool, ProcessExecutor processExecutor, long timeoutSeconds,
                            long probeTimeoutSeconds, Path tempRoot) {
        this.tool = tool;
        this.processExecutor = processExecutor;
        this.timeoutSeconds = timeoutSeconds;
        this.probeTimeoutSeconds = probeTimeoutSeconds;
        this.tempRoot = tempRoot;
    }

    @Override
    public String name() {
        return tool.name().toLowerCase();
    }

    /**
     * The tool counts as installed when its version command can be started and exits before the
     * probe timeout. Some tools report their version with a non-zero exit code, so the code is
     * not checked.
     */
    @Override
    public boolean probe() {
        try {
            ProcessResult result = processExecutor.execute(tool.probeCommand(), "probe", probeTimeoutSeconds,
                    tool.executable());
            log.debug("Probe of '{}' exited with code {}.", tool.executable(), result.exitCode());
            return true;
        } catch (IOException e) {
            log.debug("Probe of '{}' failed: {}", tool.executable(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public RenderResult render(Path pdf, int pageNumber, int dpi) {
        String contextInfo = pdf.getFileName() + " p" + pageNumber;
        Path workDir = null;
        try {
            Files.createDirectories(tempRoot);
            workDir = Files.createTempDirectory(tempRoot, "render-" + name() + "-");
            Path output = workDir.resolve("page.png");
            List<String> command = tool.renderCommand(pdf.toAbsolutePath(), pageNumber, dpi, output);
            ProcessResult result = processExecutor.execute(command, contextInfo, timeoutSeconds, tool.executable());

            if (result.exitCode() != 0) {
                return RenderResult.error(name(),
                        String.format("%s exited with code %d: %s", tool.executable(), result.exitCode(),
                                result.stderr()));
            }
            if (!Files.isRegularFile(output)) {
                return RenderResult.error(name(), tool.executable() + " produced no output file");
            }
            BufferedImage image = ImageIO.read(output.toFile());
            if (image == null) {
                return RenderResult.error(name(), tool.executable() + " produced an unreadable image");
            }
            return RenderResult.rendered(name(), image);
        } catch (IOException e) {
            String message = String.valueOf(e.getMessage());
            if (message.startsWith("Cannot run program")) {
                return RenderResult.unavailable(name(), message);
            }
            return RenderResult.error(name(), message);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RenderResult.error(name(), "interrupted while waiting for " + tool.executable());
        } finally {
            if (workDir != null) {
                FileUtils.deleteQuietly(workDir.toFile());
            }
        }
    }
}
