package com.eyelevel.pagepipeline.service.pdf;

import com.eyelevel.pagepipeline.config.DocumentProcessingConfig;
import com.eyelevel.pagepipeline.exception.FileProtectedException;
import com.eyelevel.pagepipeline.exception.InvalidSourceDocumentException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Validates a source document and reads its page count with Apache PDFBox.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfPageCounter {

    private final DocumentProcessingConfig config;

    /**
     * @param pdf path to the source file
     * @return number of pages, possibly zero
     * @throws InvalidSourceDocumentException if the file is missing, empty, too large or not a readable PDF
     * @throws FileProtectedException         if the file needs a password to open
     */
    public int countPages(Path pdf) {
        if (!Files.isRegularFile(pdf)) {
            throw new InvalidSourceDocumentException("Source file does not exist: " + pdf);
        }
        File file = pdf.toFile();
        long size = file.length();
        if (size == 0) {
            throw new InvalidSourceDocumentException("Source file is empty: " + pdf.getFileName());
        }
        long maxFileSize = config.getMaxFileSize();
        if (maxFileSize > 0 && size > maxFileSize) {
            throw new InvalidSourceDocumentException(String.format("Source file '%s' is %s, above the limit of %s.",
                    pdf.getFileName(), FileUtils.byteCountToDisplaySize(size),
                    FileUtils.byteCountToDisplaySize(maxFileSize)));
        }

        try (PDDocument document = Loader.loadPDF(file)) {
            int pages = document.getNumberOfPages();
            log.debug("'{}' has {} pages.", pdf.getFileName(), pages);
            return pages;
        } catch (InvalidPasswordException e) {
            throw new FileProtectedException("Source file is password protected: " + pdf.getFileName(), e);
        } catch (IOException e) {
            throw new InvalidSourceDocumentException("Source file is not a readable PDF: " + pdf.getFileName(), e);
        }
    }
}
