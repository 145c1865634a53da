package nasa.nccs.regrid.cdm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A grid mapping or formula-terms coordinate reference: the coordinates it applies to, the domain
 * ancillaries that hold its terms, and its scalar parameters.
 */
public class CoordinateReference {
    private final String name;
    private final Set<String> coordinates = new LinkedHashSet<String>();
    private final Map<String, String> domainAncillaries = new LinkedHashMap<String, String>();
    private final Map<String, String> parameters = new LinkedHashMap<String, String>();

    public CoordinateReference( String name ) { this.name = name; }

    public String getName() { return name; }

    public Set<String> getCoordinates() { return Collections.unmodifiableSet( coordinates ); }

    public CoordinateReference addCoordinate( String key ) {
        coordinates.add( key );
        return this;
    }

    void removeCoordinate( String key ) { coordinates.remove( key ); }

    /** Term name to domain ancillary key; a {@code null} key means the term is unset. */
    public Map<String, String> getDomainAncillaries() { return Collections.unmodifiableMap( domainAncillaries ); }

    public CoordinateReference setDomainAncillary( String term, String key ) {
        domainAncillaries.put( term, key );
        return this;
    }

    void clearDomainAncillary( String key ) {
        for( Map.Entry<String, String> entry: domainAncillaries.entrySet() ) {
            if( key.equals( entry.getValue() ) ) { entry.setValue( null ); }
        }
    }

    public Map<String, String> getParameters() { return Collections.unmodifiableMap( parameters ); }

    public CoordinateReference setParameter( String term, String value ) {
        parameters.put( term, value );
        return this;
    }

    public CoordinateReference copy() {
        CoordinateReference ref = new CoordinateReference( name );
        ref.coordinates.addAll( coordinates );
        ref.domainAncillaries.putAll( domainAncillaries );
        ref.parameters.putAll( parameters );
        return ref;
    }

    public String toString() { return "Coordinate reference: " + name; }
}
