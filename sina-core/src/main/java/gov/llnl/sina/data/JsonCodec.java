package gov.llnl.sina.data;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import javax.annotation.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * Conversion of records, relationships and documents from and to their JSON representation.
 * <p>
 * A document is a JSON object with top-level {@code records} and {@code relationships} arrays.
 * A record object has an {@code id} (or a {@code local_id}, replaced by a generated id and
 * resolvable by sibling relationships through {@code local_subject} and {@code local_object}), a
 * {@code type}, and optional {@code data}, {@code files}, {@code curve_sets},
 * {@code library_data} and {@code user_defined} members. Files are accepted both as an object
 * keyed by URI and as a legacy array of objects with an {@code uri} member. Top-level string
 * members of records whose type has a registered {@link RecordExtensions extension} are read into
 * that extension.
 * </p>
 * <p>
 * Reading methods throw {@link ParseException} on malformed input.
 * </p>
 */
public final class JsonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Set<String> RECORD_MEMBERS = ImmutableSet.of("id", "local_id", "type",
            "data", "files", "curve_sets", "library_data", "user_defined");

    public static ObjectMapper getMapper() {
        return MAPPER;
    }

    public static Document readDocument(final InputStream stream) throws IOException {
        final JsonNode root;
        try {
            root = MAPPER.readTree(stream);
        } catch (final JsonProcessingException ex) {
            throw new ParseException("<stream>", "Invalid JSON document: " + ex.getOriginalMessage(), ex);
        }
        return readDocument(root);
    }

    public static Document readDocument(final String json) {
        return readDocument(parse(json));
    }

    /**
     * Reads a document, generating ids for records having only a {@code local_id} and resolving
     * local references in relationships.
     *
     * @param root
     *            the document root
     * @return the parsed document
     * @throws ParseException
     *             if the document is malformed or references an undefined local id
     */
    public static Document readDocument(final JsonNode root) throws ParseException {
        if (root == null || !root.isObject()) {
            throw new ParseException(String.valueOf(root), "Document must be a JSON object");
        }
        final Map<String, String> localIds = Maps.newHashMap();
        final List<Record> records = Lists.newArrayList();
        for (final JsonNode node : elements(root.get("records"))) {
            final String localId = text(node, "local_id");
            String id = text(node, "id");
            if (id == null) {
                if (localId == null) {
                    throw new ParseException(node.toString(),
                            "Record requires one of: local_id, id");
                }
                id = UUID.randomUUID().toString().replace("-", "");
            }
            if (localId != null) {
                localIds.put(localId, id);
            }
            records.add(readRecord(node, id));
        }
        final List<Relationship> relationships = Lists.newArrayList();
        for (final JsonNode node : elements(root.get("relationships"))) {
            final String subject = resolve(node, "subject", "local_subject", localIds);
            final String object = resolve(node, "object", "local_object", localIds);
            final String predicate = text(node, "predicate");
            if (predicate == null) {
                throw new ParseException(node.toString(), "Relationship requires a predicate");
            }
            relationships.add(new Relationship(subject, predicate, object));
        }
        return new Document(records, relationships);
    }

    private static String resolve(final JsonNode node, final String globalName,
            final String localName, final Map<String, String> localIds) {
        final String global = text(node, globalName);
        if (global != null) {
            return global;
        }
        final String local = text(node, localName);
        if (local == null) {
            throw new ParseException(node.toString(), "Relationship requires one of: "
                    + globalName + ", " + localName);
        }
        final String resolved = localIds.get(local);
        if (resolved == null) {
            throw new ParseException(node.toString(), localName
                    + " must be the local_id of a record within the same document");
        }
        return resolved;
    }

    public static Record readRecord(final String json) {
        return readRecord(parse(json), null);
    }

    public static Record readRecord(final JsonNode node) {
        return readRecord(node, null);
    }

    private static Record readRecord(final JsonNode node, @Nullable final String assignedId) {
        if (node == null || !node.isObject()) {
            throw new ParseException(String.valueOf(node), "Record must be a JSON object");
        }
        final String id = assignedId != null ? assignedId : text(node, "id");
        final String type = text(node, "type");
        if (id == null || type == null) {
            throw new ParseException(node.toString(), "Record requires both id and type");
        }
        try {
            final Record.Builder builder = Record.builder(id, type);
            final Iterator<Map.Entry<String, JsonNode>> data = fields(node.get("data"));
            while (data.hasNext()) {
                final Map.Entry<String, JsonNode> entry = data.next();
                builder.datum(entry.getKey(), readDatum(entry.getValue()));
            }
            final JsonNode files = node.get("files");
            if (files != null && files.isArray()) {
                for (final JsonNode file : files) {
                    builder.file(readFile(text(file, "uri"), file));
                }
            } else {
                final Iterator<Map.Entry<String, JsonNode>> i = fields(files);
                while (i.hasNext()) {
                    final Map.Entry<String, JsonNode> entry = i.next();
                    builder.file(readFile(entry.getKey(), entry.getValue()));
                }
            }
            final Iterator<Map.Entry<String, JsonNode>> curveSets = fields(node.get("curve_sets"));
            while (curveSets.hasNext()) {
                final Map.Entry<String, JsonNode> entry = curveSets.next();
                builder.curveSet(new CurveSet(entry.getKey(), readCurves(entry.getValue().get(
                        "independent")), readCurves(entry.getValue().get("dependent"))));
            }
            builder.libraryData(nonNull(node.get("library_data")));
            builder.userDefined(nonNull(node.get("user_defined")));
            if (RecordExtensions.isRegistered(type)) {
                final Map<String, String> extensionFields = Maps.newLinkedHashMap();
                final Iterator<Map.Entry<String, JsonNode>> i = node.fields();
                while (i.hasNext()) {
                    final Map.Entry<String, JsonNode> entry = i.next();
                    if (!RECORD_MEMBERS.contains(entry.getKey()) && entry.getValue().isTextual()) {
                        extensionFields.put(entry.getKey(), entry.getValue().asText());
                    }
                }
                builder.extension(RecordExtensions.create(type, extensionFields));
            }
            return builder.build();
        } catch (final ParseException ex) {
            throw ex;
        } catch (final IllegalArgumentException | NullPointerException ex) {
            throw new ParseException(node.toString(), "Invalid record " + id + ": "
                    + ex.getMessage(), ex);
        }
    }

    public static Datum readDatum(final JsonNode node) {
        final JsonNode value = node.get("value");
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing datum value in " + node);
        }
        final Object javaValue;
        if (value.isNumber()) {
            javaValue = value.doubleValue();
        } else if (value.isTextual()) {
            javaValue = value.textValue();
        } else if (value.isArray()) {
            final List<Object> list = Lists.newArrayList();
            for (final JsonNode element : value) {
                if (element.isNumber()) {
                    list.add(element.doubleValue());
                } else if (element.isTextual()) {
                    list.add(element.textValue());
                } else {
                    throw new IllegalArgumentException("Unsupported list element " + element);
                }
            }
            javaValue = list;
        } else {
            throw new IllegalArgumentException("Unsupported datum value " + value);
        }
        return Datum.of(javaValue, text(node, "units"), readTags(node));
    }

    private static FileEntry readFile(@Nullable final String uri, final JsonNode node) {
        if (uri == null) {
            throw new IllegalArgumentException("File without uri: " + node);
        }
        return new FileEntry(uri, text(node, "mimetype"), readTags(node));
    }

    private static List<Curve> readCurves(@Nullable final JsonNode node) {
        final List<Curve> curves = Lists.newArrayList();
        final Iterator<Map.Entry<String, JsonNode>> i = fields(node);
        while (i.hasNext()) {
            final Map.Entry<String, JsonNode> entry = i.next();
            final List<Double> values = Lists.newArrayList();
            for (final JsonNode value : elements(entry.getValue().get("value"))) {
                if (!value.isNumber()) {
                    throw new IllegalArgumentException("Curve values must be numbers: "
                            + entry.getKey());
                }
                values.add(value.doubleValue());
            }
            curves.add(new Curve(entry.getKey(), values, text(entry.getValue(), "units"),
                    readTags(entry.getValue())));
        }
        return curves;
    }

    @Nullable
    private static List<String> readTags(final JsonNode node) {
        final JsonNode tags = node.get("tags");
        if (tags == null || tags.isNull()) {
            return null;
        }
        final List<String> result = Lists.newArrayList();
        for (final JsonNode tag : elements(tags)) {
            result.add(tag.asText());
        }
        return result;
    }

    public static Relationship readRelationship(final JsonNode node) {
        final String subject = text(node, "subject");
        final String predicate = text(node, "predicate");
        final String object = text(node, "object");
        if (subject == null || predicate == null || object == null) {
            throw new ParseException(node.toString(),
                    "Relationship requires subject, predicate and object");
        }
        return new Relationship(subject, predicate, object);
    }

    public static ObjectNode writeRecord(final Record record) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("id", record.getId());
        node.put("type", record.getType());
        if (record.getExtension() != null) {
            for (final Map.Entry<String, String> entry : record.getExtension().getFields()
                    .entrySet()) {
                node.put(entry.getKey(), entry.getValue());
            }
        }
        if (!record.getData().isEmpty()) {
            final ObjectNode data = node.putObject("data");
            for (final Map.Entry<String, Datum> entry : record.getData().entrySet()) {
                data.set(entry.getKey(), writeDatum(entry.getValue()));
            }
        }
        if (!record.getFiles().isEmpty()) {
            final ObjectNode files = node.putObject("files");
            for (final FileEntry file : record.getFiles().values()) {
                final ObjectNode fileNode = files.putObject(file.getURI());
                if (file.getMimeType() != null) {
                    fileNode.put("mimetype", file.getMimeType());
                }
                writeTags(fileNode, file.getTags());
            }
        }
        if (!record.getCurveSets().isEmpty()) {
            final ObjectNode curveSets = node.putObject("curve_sets");
            for (final CurveSet curveSet : record.getCurveSets().values()) {
                final ObjectNode curveSetNode = curveSets.putObject(curveSet.getName());
                writeCurves(curveSetNode.putObject("independent"), curveSet.getIndependent());
                writeCurves(curveSetNode.putObject("dependent"), curveSet.getDependent());
            }
        }
        if (record.getLibraryData() != null) {
            node.set("library_data", record.getLibraryData());
        }
        if (record.getUserDefined() != null) {
            node.set("user_defined", record.getUserDefined());
        }
        return node;
    }

    public static ObjectNode writeDatum(final Datum datum) {
        final ObjectNode node = MAPPER.createObjectNode();
        switch (datum.getKind()) {
        case SCALAR:
            node.put("value", datum.asScalar());
            break;
        case STRING:
            node.put("value", datum.asString());
            break;
        case SCALAR_LIST:
            final ArrayNode scalars = node.putArray("value");
            for (final Double value : datum.asScalarList()) {
                scalars.add(value);
            }
            break;
        case STRING_LIST:
            final ArrayNode strings = node.putArray("value");
            for (final String value : datum.asStringList()) {
                strings.add(value);
            }
            break;
        default:
            throw new Error("Unexpected kind " + datum.getKind());
        }
        if (datum.getUnits() != null) {
            node.put("units", datum.getUnits());
        }
        writeTags(node, datum.getTags());
        return node;
    }

    private static void writeCurves(final ObjectNode node, final Map<String, Curve> curves) {
        for (final Curve curve : curves.values()) {
            final ObjectNode curveNode = node.putObject(curve.getName());
            final ArrayNode values = curveNode.putArray("value");
            for (final Double value : curve.getValues()) {
                values.add(value);
            }
            if (curve.getUnits() != null) {
                curveNode.put("units", curve.getUnits());
            }
            writeTags(curveNode, curve.getTags());
        }
    }

    private static void writeTags(final ObjectNode node, final List<String> tags) {
        if (!tags.isEmpty()) {
            final ArrayNode array = node.putArray("tags");
            for (final String tag : tags) {
                array.add(tag);
            }
        }
    }

    public static ObjectNode writeRelationship(final Relationship relationship) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("subject", relationship.getSubject());
        node.put("predicate", relationship.getPredicate());
        node.put("object", relationship.getObject());
        return node;
    }

    public static ObjectNode writeDocument(final Document document) {
        final ObjectNode node = MAPPER.createObjectNode();
        final ArrayNode records = node.putArray("records");
        for (final Record record : document.getRecords()) {
            records.add(writeRecord(record));
        }
        final ArrayNode relationships = node.putArray("relationships");
        for (final Relationship relationship : document.getRelationships()) {
            relationships.add(writeRelationship(relationship));
        }
        return node;
    }

    public static void writeDocument(final Document document, final OutputStream stream)
            throws IOException {
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(stream, writeDocument(document));
    }

    public static String toJson(final Record record) {
        return writeRecord(record).toString();
    }

    /**
     * Parses a string into a JSON tree, rejecting malformed content.
     */
    public static JsonNode parse(final String json) throws ParseException {
        try {
            return MAPPER.readTree(json);
        } catch (final IOException ex) {
            throw new ParseException(json, "Invalid JSON", ex);
        }
    }

    @Nullable
    private static String text(@Nullable final JsonNode node, final String member) {
        final JsonNode value = node == null ? null : node.get(member);
        return value == null || value.isNull() ? null : value.asText();
    }

    @Nullable
    private static JsonNode nonNull(@Nullable final JsonNode node) {
        return node == null || node.isNull() ? null : node;
    }

    private static Iterable<JsonNode> elements(@Nullable final JsonNode node) {
        if (node == null || node.isNull()) {
            return ImmutableList.of();
        } else if (!node.isArray()) {
            throw new ParseException(node.toString(), "Expected a JSON array");
        }
        return node;
    }

    private static Iterator<Map.Entry<String, JsonNode>> fields(@Nullable final JsonNode node) {
        if (node == null || node.isNull()) {
            return ImmutableList.<Map.Entry<String, JsonNode>>of().iterator();
        } else if (!node.isObject()) {
            throw new ParseException(node.toString(), "Expected a JSON object");
        }
        return node.fields();
    }

    private JsonCodec() {
    }

}
