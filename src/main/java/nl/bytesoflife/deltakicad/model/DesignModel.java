package nl.bytesoflife.deltakicad.model;

import java.util.List;

/**
 * The extracted content of one design file.
 */
public interface DesignModel {

    String source();

    List<? extends Component> components();

    List<ExtractionIssue> issues();
}
