package net.lexiconnect.model;

/**
 * Implemented by every model that sits in an ordered sibling collection.
 * Siblings are serialized by ascending order, ties broken by ID.
 */
public interface OrderedModel {
    String getId();
    int getOrder();
}
