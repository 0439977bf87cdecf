package io.github.themoah.ybstats.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.github.themoah.ybstats.model.CatalogEntry;
import io.github.themoah.ybstats.model.CollectionPass;
import io.github.themoah.ybstats.model.EndpointKind;
import io.github.themoah.ybstats.model.StoredRecord;
import io.github.themoah.ybstats.schema.KindSchemas;
import java.io.IOException;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Versioned on-disk store: one numbered directory per snapshot holding one CSV file per
 * endpoint kind, plus the append-only catalog {@value #CATALOG_FILE} at the root.
 *
 * <p>All methods block on the file system. Callers on an event loop run them through
 * {@code executeBlocking}. A single writer process per root is assumed; nothing is locked.
 */
public class SnapshotStore {

  private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

  public static final String CATALOG_FILE = "snapshot.index";

  static final String HOSTNAME_PORT = "hostname_port";
  static final String TIMESTAMP = "timestamp";
  static final String SYNTHETIC = "synthetic";

  private static final List<String> CATALOG_COLUMNS = List.of("number", "timestamp", "comment");
  private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

  private static final CsvMapper mapper;

  static {
    mapper = new CsvMapper();
    mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
  }

  private final Path root;

  public SnapshotStore(Path root) {
    this.root = root;
  }

  public Path root() {
    return root;
  }

  /**
   * Allocates the next snapshot number, creates its directory and appends it to the
   * catalog. The catalog is forced to disk before the entry is returned.
   *
   * @param comment free text, may be empty
   * @return the new catalog entry
   * @throws SnapshotWriteException if the directory or catalog cannot be written
   * @throws SnapshotCorruptException if the existing catalog cannot be read
   */
  public CatalogEntry beginSnapshot(String comment) {
    int highest = Math.max(
      listSnapshots().stream().mapToInt(CatalogEntry::number).max().orElse(0),
      highestDirectoryNumber());
    CatalogEntry entry = new CatalogEntry(highest + 1, OffsetDateTime.now(), comment == null ? "" : comment);

    try {
      Files.createDirectories(snapshotDirectory(entry.number()));
      appendToCatalog(entry);
    } catch (IOException e) {
      throw new SnapshotWriteException("Cannot create snapshot " + entry.number() + " in " + root, e);
    }
    log.info("Created snapshot {} in {}", entry.number(), root);
    return entry;
  }

  /**
   * Writes all records of one pass as the kind's file of a snapshot. The file appears
   * complete or not at all.
   *
   * @throws SnapshotWriteException if the file cannot be written
   */
  public void write(int number, CollectionPass pass) {
    Path directory = snapshotDirectory(number);
    EndpointKind kind = pass.kind();
    List<String> header = header(kind);
    CsvSchema.Builder schemaBuilder = CsvSchema.builder().setUseHeader(true);
    header.forEach(schemaBuilder::addColumn);
    ObjectWriter writer = mapper.writer(schemaBuilder.build());

    Path temp = null;
    try {
      temp = Files.createTempFile(directory, kind.fileName(), ".tmp");
      try (Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
        if (pass.records().isEmpty()) {
          out.write(String.join(",", header));
          out.write('\n');
        } else {
          writer.writeValues(out).writeAll(toRows(header, pass)).close();
        }
      }
      Files.move(temp, directory.resolve(kind.fileName()),
        StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      log.debug("Wrote {} {} records to snapshot {}", pass.records().size(), kind.fileName(), number);
    } catch (IOException e) {
      deleteQuietly(temp);
      throw new SnapshotWriteException("Cannot write " + kind.fileName() + " to snapshot " + number, e);
    }
  }

  /**
   * Reads the catalog.
   *
   * @return entries ordered by number, empty when no catalog exists yet
   * @throws SnapshotCorruptException if the catalog cannot be parsed
   */
  public List<CatalogEntry> listSnapshots() {
    Path catalog = root.resolve(CATALOG_FILE);
    if (!Files.exists(catalog)) {
      return List.of();
    }

    List<String[]> rows = readRows(catalog, CATALOG_FILE);
    checkHeader(rows, CATALOG_COLUMNS, CATALOG_FILE);

    List<CatalogEntry> entries = new ArrayList<>();
    for (String[] row : rows.subList(1, rows.size())) {
      if (row.length != CATALOG_COLUMNS.size()) {
        throw new SnapshotCorruptException("Catalog row has " + row.length + " fields: " + String.join(",", row));
      }
      try {
        entries.add(new CatalogEntry(Integer.parseInt(row[0].trim()), parseTime(row[1], CATALOG_FILE), row[2]));
      } catch (NumberFormatException e) {
        throw new SnapshotCorruptException("Catalog has invalid snapshot number: " + row[0], e);
      }
    }
    entries.sort(Comparator.comparingInt(CatalogEntry::number));
    return entries;
  }

  /**
   * Returns true when the catalog lists the snapshot number.
   */
  public boolean contains(int number) {
    return listSnapshots().stream().anyMatch(entry -> entry.number() == number);
  }

  /**
   * Reads one kind of a snapshot back into a pass.
   *
   * @throws SnapshotNotFoundException if the number is not catalogued or the kind file is absent
   * @throws SnapshotCorruptException if the file does not match the kind's schema
   */
  public CollectionPass load(int number, EndpointKind kind) {
    if (!contains(number)) {
      throw new SnapshotNotFoundException("Snapshot " + number + " is not in the catalog of " + root);
    }
    Path file = snapshotDirectory(number).resolve(kind.fileName());
    if (!Files.exists(file)) {
      throw new SnapshotNotFoundException("Snapshot " + number + " has no " + kind.fileName() + " file");
    }

    String source = "snapshot " + number + " " + kind.fileName();
    List<String> header = header(kind);
    List<String[]> rows = readRows(file, source);
    checkHeader(rows, header, source);

    List<StoredRecord> records = new ArrayList<>(rows.size() - 1);
    OffsetDateTime passTimestamp = null;
    for (String[] row : rows.subList(1, rows.size())) {
      if (row.length != header.size()) {
        throw new SnapshotCorruptException(source + " has a row with " + row.length
          + " fields, expected " + header.size());
      }
      OffsetDateTime timestamp = parseTime(row[1], source);
      if (passTimestamp == null) {
        passTimestamp = timestamp;
      }
      Map<String, String> fields = new LinkedHashMap<>();
      for (int i = 3; i < header.size(); i++) {
        fields.put(header.get(i), row[i]);
      }
      records.add(new StoredRecord(row[0], timestamp, parseSynthetic(row[2], source), fields));
    }

    if (passTimestamp == null) {
      passTimestamp = catalogTimestamp(number);
    }
    return new CollectionPass(kind, passTimestamp, records);
  }

  Path snapshotDirectory(int number) {
    return root.resolve(Integer.toString(number));
  }

  static List<String> header(EndpointKind kind) {
    List<String> header = new ArrayList<>();
    header.add(HOSTNAME_PORT);
    header.add(TIMESTAMP);
    header.add(SYNTHETIC);
    header.addAll(KindSchemas.forKind(kind).columns());
    return header;
  }

  private List<Map<String, String>> toRows(List<String> header, CollectionPass pass) {
    List<Map<String, String>> rows = new ArrayList<>(pass.records().size());
    for (StoredRecord record : pass.records()) {
      Map<String, String> row = new LinkedHashMap<>();
      row.put(HOSTNAME_PORT, record.hostnamePort());
      row.put(TIMESTAMP, TIME_FORMAT.format(record.timestamp()));
      row.put(SYNTHETIC, Boolean.toString(record.synthetic()));
      for (String column : header.subList(3, header.size())) {
        row.put(column, record.field(column));
      }
      rows.add(row);
    }
    return rows;
  }

  private void appendToCatalog(CatalogEntry entry) throws IOException {
    Path catalog = root.resolve(CATALOG_FILE);
    StringBuilder text = new StringBuilder();
    if (!Files.exists(catalog)) {
      text.append(String.join(",", CATALOG_COLUMNS)).append('\n');
    }
    Map<String, String> row = new LinkedHashMap<>();
    row.put("number", Integer.toString(entry.number()));
    row.put("timestamp", TIME_FORMAT.format(entry.timestamp()));
    row.put("comment", entry.comment());
    CsvSchema.Builder schemaBuilder = CsvSchema.builder();
    CATALOG_COLUMNS.forEach(schemaBuilder::addColumn);
    text.append(mapper.writer(schemaBuilder.build()).writeValueAsString(row));

    try (FileChannel channel = FileChannel.open(catalog,
        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
      ByteBuffer buffer = ByteBuffer.wrap(text.toString().getBytes(StandardCharsets.UTF_8));
      while (buffer.hasRemaining()) {
        channel.write(buffer);
      }
      channel.force(true);
    }
  }

  private int highestDirectoryNumber() {
    if (!Files.isDirectory(root)) {
      return 0;
    }
    try (Stream<Path> children = Files.list(root)) {
      return children
        .filter(Files::isDirectory)
        .map(path -> path.getFileName().toString())
        .filter(name -> name.matches("\\d{1,9}"))
        .mapToInt(Integer::parseInt)
        .max()
        .orElse(0);
    } catch (IOException e) {
      throw new SnapshotWriteException("Cannot list snapshot directory " + root, e);
    }
  }

  private OffsetDateTime catalogTimestamp(int number) {
    return listSnapshots().stream()
      .filter(entry -> entry.number() == number)
      .map(CatalogEntry::timestamp)
      .findFirst()
      .orElseThrow(() -> new SnapshotNotFoundException("Snapshot " + number + " is not in the catalog"));
  }

  private static List<String[]> readRows(Path file, String source) {
    try (MappingIterator<String[]> iterator = mapper.readerFor(String[].class).readValues(file.toFile())) {
      return iterator.readAll();
    } catch (JsonProcessingException e) {
      throw new SnapshotCorruptException("Cannot parse " + source + ": " + e.getOriginalMessage(), e);
    } catch (RuntimeJsonMappingException e) {
      throw new SnapshotCorruptException("Cannot parse " + source + ": " + e.getMessage(), e);
    } catch (IOException e) {
      throw new SnapshotCorruptException("Cannot read " + source + ": " + e.getMessage(), e);
    }
  }

  private static void checkHeader(List<String[]> rows, List<String> expected, String source) {
    if (rows.isEmpty()) {
      throw new SnapshotCorruptException(source + " is empty, expected header " + expected);
    }
    List<String> actual = List.of(rows.get(0));
    if (!actual.equals(expected)) {
      throw new SnapshotCorruptException(source + " has header " + actual + ", expected " + expected);
    }
  }

  private static OffsetDateTime parseTime(String value, String source) {
    try {
      return OffsetDateTime.parse(value.trim(), TIME_FORMAT);
    } catch (DateTimeParseException e) {
      throw new SnapshotCorruptException(source + " has an invalid timestamp: " + value, e);
    }
  }

  private static boolean parseSynthetic(String value, String source) {
    if ("true".equals(value)) {
      return true;
    }
    if ("false".equals(value)) {
      return false;
    }
    throw new SnapshotCorruptException(source + " has an invalid synthetic flag: " + value);
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Cannot remove temporary file {}: {}", path, e.getMessage());
    }
  }
}
