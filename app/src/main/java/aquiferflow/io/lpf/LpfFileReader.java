package aquiferflow.io.lpf;

import aquiferflow.config.LpfConfig;
import aquiferflow.domain.array.FieldInput;
import aquiferflow.domain.array.GridSlice;
import aquiferflow.domain.array.LayerSlice;
import aquiferflow.domain.array.LayerVector;
import aquiferflow.domain.exception.PackageFormatException;
import aquiferflow.domain.lpf.LpfField;
import aquiferflow.domain.lpf.LpfOption;
import aquiferflow.domain.lpf.LpfPackage;
import aquiferflow.domain.model.GroundwaterModel;
import aquiferflow.io.LineSource;
import aquiferflow.io.array.ArrayBlockReader;
import aquiferflow.io.array.LayerVectorCodec;
import aquiferflow.io.param.ModflowParameterReader;
import aquiferflow.io.param.ParameterLoader;
import aquiferflow.io.param.ParameterSet;
import aquiferflow.validation.CheckLevel;
import aquiferflow.validation.LpfChecker;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lee un paquete LPF recorriendo exactamente la misma secuencia condicional que
 * {@link LpfFileWriter}, descrita en {@link LpfLayout}.
 * <p>
 * Si la cabecera declara parámetros, se cargan con el {@link ParameterLoader} y cada bloque
 * de un campo con parámetros de su tipo se sustituye por una línea de control y el valor
 * rellenado a partir de ellos. Cualquier error de formato es fatal: no hay forma de
 * resincronizar la lectura.
 */
@Slf4j
public class LpfFileReader {

    private final ParameterLoader parameterLoader;
    private final LpfChecker checker;

    public LpfFileReader() {
        this(new ModflowParameterReader(), new LpfChecker());
    }

    public LpfFileReader(ParameterLoader parameterLoader, LpfChecker checker) {
        this.parameterLoader = Objects.requireNonNull(parameterLoader, "El cargador de parámetros no puede ser nulo.");
        this.checker = Objects.requireNonNull(checker, "El validador no puede ser nulo.");
    }

    /**
     * Carga el paquete desde un archivo y lo registra en el modelo.
     *
     * @param packageUnit   Unidad del archivo del paquete. Un registro de control en formato
     *                      fijo con LOCAT igual a ella se lee como datos internos.
     * @param externalUnits Archivos asociados a las unidades de los bloques {@code EXTERNAL}.
     * @param check         Si es verdadero, valida a nivel resumen y guarda el informe en
     *                      {@code <workspace>/LPF.chk}, sin mostrarlo.
     * @throws PackageFormatException si el archivo está mal formado o truncado.
     */
    public LpfPackage load(Path path, GroundwaterModel model, int packageUnit, Map<Integer, Path> externalUnits,
                           boolean check) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("El archivo del paquete LPF no existe: " + path.toAbsolutePath());
        }
        Path baseDirectory = path.toAbsolutePath().getParent();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString(), baseDirectory, model, packageUnit, externalUnits, check);
        }
    }

    public LpfPackage load(Path path, GroundwaterModel model, Map<Integer, Path> externalUnits, boolean check)
            throws IOException {
        return load(path, model, LpfConfig.DEFAULT_UNIT_NUMBER, externalUnits, check);
    }

    public LpfPackage load(Path path, GroundwaterModel model) throws IOException {
        return load(path, model, Collections.emptyMap(), false);
    }

    /**
     * Carga el paquete desde un lector ya abierto y lo registra en el modelo. La unidad de
     * balance solo se reserva si el registro tiene éxito.
     *
     * @param baseDirectory Directorio contra el que se resuelven las rutas de los bloques externos.
     */
    public LpfPackage load(BufferedReader reader, String sourceName, Path baseDirectory, GroundwaterModel model,
                           int packageUnit, Map<Integer, Path> externalUnits, boolean check) throws IOException {
        log.info("Cargando el paquete LPF desde {}", sourceName);
        Decoded decoded = decodeSource(reader, sourceName, baseDirectory, model, packageUnit, externalUnits);
        LpfPackage lpf = decoded.lpf();
        model.registerPackage(lpf).orThrow(lpf.getPackageType());
        if (decoded.rawBudgetFlag() != 0) {
            model.addConsumedUnit(decoded.rawBudgetFlag());
        }
        if (check) {
            checker.check(lpf, model, CheckLevel.SUMMARY, model.getWorkspace().resolve(LpfFileWriter.CHECK_FILE),
                    null);
        }
        log.info("Paquete LPF cargado: {} capas, opciones [{}].", lpf.getLayerCount(), lpf.getOptionsString());
        return lpf;
    }

    public LpfPackage load(BufferedReader reader, String sourceName, Path baseDirectory, GroundwaterModel model,
                           Map<Integer, Path> externalUnits, boolean check) throws IOException {
        return load(reader, sourceName, baseDirectory, model, LpfConfig.DEFAULT_UNIT_NUMBER, externalUnits, check);
    }

    /**
     * Lee el paquete sin efectos sobre el modelo: no registra el paquete ni la unidad de balance.
     */
    public LpfPackage decode(BufferedReader reader, String sourceName, Path baseDirectory, GroundwaterModel model,
                             int packageUnit, Map<Integer, Path> externalUnits) throws IOException {
        return decodeSource(reader, sourceName, baseDirectory, model, packageUnit, externalUnits).lpf();
    }

    public LpfPackage decode(BufferedReader reader, String sourceName, Path baseDirectory, GroundwaterModel model,
                             Map<Integer, Path> externalUnits) throws IOException {
        return decode(reader, sourceName, baseDirectory, model, LpfConfig.DEFAULT_UNIT_NUMBER, externalUnits);
    }

    private record Decoded(LpfPackage lpf, int rawBudgetFlag) {
    }

    private Decoded decodeSource(BufferedReader reader, String sourceName, Path baseDirectory,
                                 GroundwaterModel model, int packageUnit, Map<Integer, Path> externalUnits)
            throws IOException {
        Objects.requireNonNull(model, "El modelo no puede ser nulo.");
        LineSource source = new LineSource(reader, sourceName);
        int nlay = model.getNlay();
        int nrow = model.getNrow();
        int ncol = model.getNcol();
        LpfConfig defaults = LpfConfig.defaults();

        String headerLine = source.nextNonCommentLine("cabecera IPAKCB HDRY NPLPF");
        LpfHeader header = LpfHeader.parse(headerLine, source);
        for (String token : LpfHeader.unrecognizedTokens(headerLine)) {
            log.warn("Token de cabecera desconocido '{}' en la línea {}; se ignora.", token, source.getLineNumber());
        }

        int[] laytyp = LayerVectorCodec.readInts(source, "LAYTYP", nlay);
        int[] layavg = LayerVectorCodec.readInts(source, "LAYAVG", nlay);
        float[] chani = LayerVectorCodec.readFloats(source, "CHANI", nlay);
        int[] layvka = LayerVectorCodec.readInts(source, "LAYVKA", nlay);
        int[] laywet = LayerVectorCodec.readInts(source, "LAYWET", nlay);

        LayerVector layerType = LayerVector.ofInts("laytyp", laytyp, nlay);
        LayerVector horizAnisoFlag = LayerVector.ofFloats("chani", chani, nlay);
        LayerVector vertCondFlag = LayerVector.ofInts("layvka", layvka, nlay);
        LayerVector wetFlag = LayerVector.ofInts("laywet", laywet, nlay);

        LpfConfig.LpfConfigBuilder config = defaults.toBuilder()
                .unitNumber(packageUnit)
                .saveBudgetFlag(header.saveBudgetFlag())
                .dryHead(header.dryHead())
                .parameterCount(header.parameterCount())
                .layerType(laytyp)
                .layerAvg(layavg)
                .horizAnisoFlag(chani)
                .vertCondFlag(layvka)
                .wetFlag(laywet)
                .storageCoefficient(header.options().contains(LpfOption.STORAGECOEFFICIENT))
                .constantCv(header.options().contains(LpfOption.CONSTANTCV))
                .thickStrt(header.options().contains(LpfOption.THICKSTRT))
                .noCvCorrection(header.options().contains(LpfOption.NOCVCORRECTION))
                .noVfc(header.options().contains(LpfOption.NOVFC));

        if (LpfLayout.hasWettingLine(wetFlag)) {
            String line = source.nextLine("WETFCT IWETIT IHDWET");
            List<String> tokens = LineSource.tokenize(line);
            if (tokens.size() < 3) {
                throw new PackageFormatException("Se esperaban WETFCT, IWETIT e IHDWET: '" + line.trim() + "'",
                        source.getLineNumber());
            }
            config.wetFactor(source.parseReal(tokens.get(0), "WETFCT"))
                    .wetIterInterval(source.parseInt(tokens.get(1), "IWETIT"))
                    .wetEquationFlag(source.parseInt(tokens.get(2), "IHDWET"));
        }

        ParameterSet parameters = ParameterSet.EMPTY;
        if (header.parameterCount() > 0) {
            log.debug("Cargando {} parámetros.", header.parameterCount());
            parameters = parameterLoader.load(source, header.parameterCount(), model);
        }

        Map<LpfField, LayerSlice[]> read = new EnumMap<>(LpfField.class);
        for (LpfField field : LpfField.values()) {
            read.put(field, new LayerSlice[nlay]);
        }
        boolean storageCoefficient = header.options().contains(LpfOption.STORAGECOEFFICIENT);
        try (ArrayBlockReader arrays = new ArrayBlockReader(baseDirectory, packageUnit, externalUnits)) {
            for (int k = 0; k < nlay; k++) {
                LpfLayout.LayerContext context = LpfLayout.context(k, layerType, horizAnisoFlag, vertCondFlag,
                        wetFlag, model);
                for (LpfLayout.Step step : LpfLayout.STEPS) {
                    if (!step.isPresent(context)) {
                        continue;
                    }
                    LpfField field = step.field();
                    String label = LpfLayout.label(field, context, storageCoefficient);
                    Optional<String> parameterType = parameters.firstDefined(field.getParameterTypes());
                    if (parameterType.isPresent()) {
                        log.debug("Cargando {} a partir de parámetros {}", label, parameterType.get());
                        source.nextLine("línea de control de " + label);
                        read.get(field)[k] = new GridSlice(parameters.fill(parameterType.get(), k, nrow, ncol));
                    } else {
                        log.debug("Cargando {}", label);
                        read.get(field)[k] = arrays.read(source, label, nrow, ncol);
                    }
                }
            }
        }

        for (LpfField field : LpfField.values()) {
            LayerSlice[] slices = read.get(field);
            List<LayerSlice> layers = new ArrayList<>(nlay);
            List<LayerSlice> fallback = defaults.inputFor(field)
                    .resolve(field.getBaseName(), Collections.nCopies(nlay, field.getBaseName()), nrow, ncol)
                    .getSlices();
            for (int k = 0; k < nlay; k++) {
                layers.add(slices[k] != null ? slices[k] : fallback.get(k));
            }
            setField(config, field, FieldInput.layers(layers));
        }

        LpfPackage lpf = LpfPackage.create(model, config.build());
        return new Decoded(lpf, header.saveBudgetFlag());
    }

    private static void setField(LpfConfig.LpfConfigBuilder config, LpfField field, FieldInput input) {
        switch (field) {
            case HORIZONTAL_CONDUCTIVITY:
                config.horizCond(input);
                break;
            case HORIZONTAL_ANISOTROPY:
                config.horizAnisoArray(input);
                break;
            case VERTICAL_CONDUCTIVITY:
                config.vertCond(input);
                break;
            case SPECIFIC_STORAGE:
                config.specificStorage(input);
                break;
            case SPECIFIC_YIELD:
                config.specificYield(input);
                break;
            case CONFINING_BED_CONDUCTIVITY:
                config.confiningBedCond(input);
                break;
            case WET_DRY:
                config.wetDryParams(input);
                break;
            default:
                throw new IllegalStateException("Campo LPF desconocido: " + field);
        }
    }
}
