/**
 * Pure Java value types shared across all ModelGate modules.
 *
 * <p>Holds the unified chat-completion schema every provider reply is
 * normalized into. No framework dependencies beyond Jackson annotations.
 */
package com.libragraph.modelgate.types;
