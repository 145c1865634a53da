package nasa.nccs.regrid.engine.worker;

import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.Map;

/**
 * An array received from a worker: a header {@code array-<pid>|id|origin|shape|metadata} and a
 * big-endian payload. The payload holds doubles unless the metadata says {@code dtype:int32}.
 */
public class TransVar {
    public static final String DTYPE = "dtype";
    public static final String INT32 = "int32";
    public static final String FLOAT64 = "float64";

    String _header;
    String _id;
    String _nodeId;
    byte[] _data;
    int[] _origin = null;
    int[] _shape = null;
    Map<String, String> _metadata;

    public TransVar( String header, byte[] data ) {
        _header = header;
        _data = data;
        String[] header_items = header.split( "[|]" );
        _nodeId = header_items[0].split( "[-]" )[1];
        _id = header_items[1];
        _origin = s2ia( header_items[2] );
        _shape = s2ia( header_items[3] );
        _metadata = ( header_items.length > 4 ) ? s2m( header_items[4] ) : new HashMap<String, String>();
    }

    public String toString() {
        return String.format( "TransVar: id=%s, header=%s", _id, _header );
    }

    public int[] getOrigin() { return _origin; }
    public int[] getShape() { return _shape; }
    public byte[] getData() { return _data; }
    public String id() { return _id; }
    public String nodeId() { return _nodeId; }
    public ByteBuffer getDataBuffer() { return ByteBuffer.wrap( _data ); }
    public Map<String, String> getMetaData() { return _metadata; }

    public boolean isInt() { return INT32.equals( _metadata.get( DTYPE ) ); }

    public double[] getDoubles() {
        ByteBuffer buffer = getDataBuffer();
        if( isInt() ) {
            double[] values = new double[ _data.length / 4 ];
            for( int i = 0; i < values.length; i++ ) { values[i] = buffer.getInt(); }
            return values;
        }
        double[] values = new double[ _data.length / 8 ];
        for( int i = 0; i < values.length; i++ ) { values[i] = buffer.getDouble(); }
        return values;
    }

    public int[] getInts() {
        ByteBuffer buffer = getDataBuffer();
        if( isInt() ) {
            int[] values = new int[ _data.length / 4 ];
            for( int i = 0; i < values.length; i++ ) { values[i] = buffer.getInt(); }
            return values;
        }
        int[] values = new int[ _data.length / 8 ];
        for( int i = 0; i < values.length; i++ ) { values[i] = (int) buffer.getDouble(); }
        return values;
    }

    static int[] s2ia( String s ) {
        if( s.isEmpty() ) { return new int[0]; }
        String[] items = s.split( "[,]" );
        int[] results = new int[ items.length ];
        for( int i = 0; i < items.length; i++ ) {
            try {
                results[i] = Integer.parseInt( items[i].trim() );
            } catch ( NumberFormatException nfe ) { results[i] = Integer.MAX_VALUE; }
        }
        return results;
    }

    static Map<String, String> s2m( String s ) {
        String[] items = s.split( "[;]" );
        Map<String, String> results = new HashMap<String, String>();
        for( int i = 0; i < items.length; i++ ) {
            String[] subitems = items[i].split( "[:]" );
            if( subitems.length == 2 ) { results.put( subitems[0], subitems[1] ); }
        }
        return results;
    }
}
