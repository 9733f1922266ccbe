package com.wagesearch.salary.pipeline;

import com.wagesearch.config.WageSearchProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

@Component
public class RawRecordSources {
    private final WageSearchProperties properties;

    public RawRecordSources(WageSearchProperties properties) {
        this.properties = properties;
    }

    public RawRecordSource configured() {
        WageSearchProperties.Data data = properties.getData();
        return forFile(resolvePath(data.getFile()), data.getFormat(), data.getSheet());
    }

    public RawRecordSource forFile(Path path, String format, String sheet) {
        String resolvedFormat = format == null ? "auto" : format.toLowerCase(Locale.ROOT);
        if ("auto".equals(resolvedFormat)) {
            String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
            resolvedFormat = fileName.endsWith(".csv") ? "csv" : "xlsx";
        }
        return switch (resolvedFormat) {
            case "csv" -> new CsvRawRecordSource(path);
            case "xlsx", "xls" -> new XlsxRawRecordSource(path, sheet);
            default -> throw new IllegalArgumentException("Unsupported data format: " + format);
        };
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
