package aquiferflow.validation;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Resultado de validar un paquete: texto legible, indicador agregado de error y la lista
 * de celdas erróneas.
 */
@Slf4j
public final class CheckReport {

    @Getter
    private final String packageName;
    @Getter
    private final CheckLevel level;
    @Getter
    private final String text;
    private final boolean errors;
    private final List<CellIssue> issues;

    CheckReport(String packageName, CheckLevel level, String text, boolean errors, List<CellIssue> issues) {
        this.packageName = packageName;
        this.level = level;
        this.text = text;
        this.errors = errors;
        this.issues = List.copyOf(issues);
    }

    public boolean hasErrors() {
        return errors;
    }

    public List<CellIssue> getIssues() {
        return issues;
    }

    public List<CellIssue> getIssuesFor(String fieldName) {
        return issues.stream().filter(i -> i.fieldName().equals(fieldName)).collect(Collectors.toList());
    }

    /**
     * Escribe el informe en un archivo, sobrescribiéndolo.
     */
    public void writeTo(Path destination) throws IOException {
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(destination, text + "\n", StandardCharsets.UTF_8);
            log.debug("Informe de validación {} escrito en {}", packageName, destination.toAbsolutePath());
        } catch (IOException e) {
            log.error("No se pudo escribir el informe de validación en {}", destination.toAbsolutePath(), e);
            throw e;
        }
    }

    public void echoTo(PrintStream out) {
        out.println(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
