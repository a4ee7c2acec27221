/**
 * Ports between the upload engine and whatever keeps its session records.
 * The engine only talks to {@link vn.com.fecredit.filestore.port.interfaces.SessionStore};
 * adapters live in {@code port.impl}.
 */
package vn.com.fecredit.filestore.port;
