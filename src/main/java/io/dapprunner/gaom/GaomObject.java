package io.dapprunner.gaom;

import java.util.List;

/**
 * Object node of the application object model, exposing its fields in declaration order.
 */
public interface GaomObject {
    List<GaomField> gaomFields();
}
