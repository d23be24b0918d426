package gov.llnl.sina.datastore.hbase.utils;

/**
 * Class containing the configuration properties and default values of the HBase data store.
 */
public class HBaseConstants {

    /** Prefix prepended to the name of every table. */
    public static final String TABLEPREFIX_PROP = "sina.hbase.tableprefix";
    public static final String TABLEPREFIX_DEFAULT = "sina_";

    /** Maximum number of rows per multi-get or batch mutation. */
    public static final String BATCHSIZE_PROP = "sina.hbase.batchsize";
    public static final int BATCHSIZE_DEFAULT = 1000;

    /** Low-level access layer property. */
    public static final String LAYER_PROP = "sina.hbase.layer";
    /** Low-level access layer options. */
    public static final String NATIVE_LAYER_OPT = "native";
    public static final String MEMORY_LAYER_OPT = "memory";

    /** HBase configuration parameters. */
    public static final String HBASE_ZOOKEEPER_QUORUM = "hbase.zookeeper.quorum";
    public static final String HBASE_ZOOKEEPER_QUORUM_DEFAULT = "localhost";
    public static final String HBASE_ZOOKEEPER_CLIENT_PORT = "hbase.zookeeper.property.clientPort";
    public static final String HBASE_ZOOKEEPER_CLIENT_PORT_DEFAULT = "2181";

    /** The single column family of every table. */
    public static final String FAMILY_NAME = "f";

    /** Table names, without prefix. */
    public static final String RECORD_TAB_NAME = "record";
    public static final String RECORD_FROM_TYPE_TAB_NAME = "record_from_type";
    public static final String SCALAR_FROM_RECORD_TAB_NAME = "scalar_from_record";
    public static final String STRING_FROM_RECORD_TAB_NAME = "string_from_record";
    public static final String SCALAR_LIST_FROM_RECORD_TAB_NAME = "scalar_list_from_record";
    public static final String STRING_LIST_FROM_RECORD_TAB_NAME = "string_list_from_record";
    public static final String RECORD_FROM_SCALAR_TAB_NAME = "record_from_scalar";
    public static final String RECORD_FROM_STRING_TAB_NAME = "record_from_string";
    public static final String RECORD_FROM_SCALAR_LIST_MIN_TAB_NAME = "record_from_scalar_list_min";
    public static final String RECORD_FROM_SCALAR_LIST_MAX_TAB_NAME = "record_from_scalar_list_max";
    public static final String RECORD_FROM_STRING_LIST_TAB_NAME = "record_from_string_list";
    public static final String RECORD_FROM_DOCUMENT_TAB_NAME = "record_from_document";
    public static final String RECORD_FROM_CURVE_SET_TAB_NAME = "record_from_curve_set";
    public static final String RECORD_FROM_MIMETYPE_TAB_NAME = "record_from_mimetype";
    public static final String OBJECT_FROM_SUBJECT_TAB_NAME = "object_from_subject";
    public static final String SUBJECT_FROM_OBJECT_TAB_NAME = "subject_from_object";

    /** Qualifiers of the record table. */
    public static final String TYPE_QUA_NAME = "type";
    public static final String RAW_QUA_NAME = "raw";

    /** Qualifier of index rows, holding units and tags. */
    public static final String META_QUA_NAME = "m";

}
