package info.isaksson.erland.typeinspect.model;

import java.util.Map;

/**
 * Common view of every inspection result, used by renderers and serializers.
 */
public interface Inspectable {

    String name();

    /** Short description from the documentation, or an empty string. */
    String description();

    /** Plain nested projection made of maps, lists, strings, numbers, booleans and nulls. */
    Map<String, Object> toData();
}
