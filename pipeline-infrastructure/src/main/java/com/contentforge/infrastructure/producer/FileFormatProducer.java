package com.contentforge.infrastructure.producer;

import com.contentforge.domain.content.model.valobj.DraftContent;
import com.contentforge.domain.content.model.valobj.ProductionOutput;
import com.contentforge.domain.execution.adapter.gateway.IFormatProducer;
import com.contentforge.domain.execution.model.valobj.StageContext;
import com.contentforge.types.enums.OutputFormatEnum;
import com.contentforge.types.enums.ResponseCode;
import com.contentforge.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Format producer writing markdown or HTML files under the configured output directory.
 * Binary document formats are not offered; they negotiate to markdown.
 *
 * @author contentforge
 * @since 2025-03-02
 */
@Slf4j
@Component
public class FileFormatProducer implements IFormatProducer {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Path outputDir;

    public FileFormatProducer(@Value("${pipeline.output.dir:./output}") String outputDir) {
        this.outputDir = Paths.get(StringUtils.defaultIfBlank(outputDir, "./output"));
    }

    @Override
    public Set<OutputFormatEnum> supportedFormats() {
        return EnumSet.of(OutputFormatEnum.MARKDOWN, OutputFormatEnum.HTML);
    }

    @Override
    public OutputFormatEnum fallbackFormat() {
        return OutputFormatEnum.MARKDOWN;
    }

    @Override
    public ProductionOutput invoke(DraftContent input, StageContext context) {
        OutputFormatEnum format = context == null || context.outputFormat() == null
                ? fallbackFormat()
                : context.outputFormat();
        if (!supports(format)) {
            throw new AppException(ResponseCode.PRODUCER_ERROR.getCode(), "Unsupported output format: " + format.getCode());
        }
        String title = context == null ? null : context.topic();
        String body = format == OutputFormatEnum.HTML
                ? toHtml(StringUtils.defaultIfBlank(title, "Untitled"), input.content())
                : input.content();
        LocalDateTime now = LocalDateTime.now();
        String kind = input.contentType() == null ? "content" : input.contentType().getCode();
        String fileName = TemplateResearchProducer.slug(StringUtils.defaultIfBlank(title, kind)) + "-" + kind + "-"
                + FILE_TIMESTAMP.format(now) + "-" + UUID.randomUUID().toString().substring(0, 8)
                + "." + format.getExtension();
        Path file = outputDir.resolve(fileName);
        try {
            Files.createDirectories(outputDir);
            Files.writeString(file, body, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AppException(ResponseCode.PRODUCER_ERROR.getCode(), "Failed to write " + file + ": " + e.getMessage(), e);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("word_count", input.wordCount());
        metadata.put("size_bytes", body.getBytes(StandardCharsets.UTF_8).length);
        metadata.put("source_format", input.format());
        log.info("Production output written. file={}, format={}, contentType={}", file, format.getCode(), kind);
        return new ProductionOutput(file.toString(), format.getCode(), input.contentType(), metadata, now);
    }

    /**
     * Minimal markdown to HTML: headings and paragraphs.
     */
    String toHtml(String title, String markdown) {
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n<title>")
                .append(escape(title)).append("</title>\n</head>\n<body>\n");
        for (String block : StringUtils.defaultString(markdown).split("\\n\\s*\\n")) {
            String text = block.trim();
            if (text.isEmpty()) {
                continue;
            }
            int level = 0;
            while (level < text.length() && level < 6 && text.charAt(level) == '#') {
                level++;
            }
            if (level > 0 && level < text.length() && text.charAt(level) == ' ') {
                html.append("<h").append(level).append('>').append(escape(text.substring(level + 1).trim()))
                        .append("</h").append(level).append(">\n");
            } else {
                html.append("<p>").append(escape(text)).append("</p>\n");
            }
        }
        return html.append("</body>\n</html>\n").toString();
    }

    private String escape(String text) {
        return StringUtils.replaceEach(text,
                new String[]{"&", "<", ">", "\""},
                new String[]{"&amp;", "&lt;", "&gt;", "&quot;"});
    }
}
