/**
 * Immutable value types shared across the engine: screen coordinates and rectangles.
 *
 * <p>Types here have no Spring dependencies and are safe to pass between the dispatch
 * thread and overlay render threads.
 */
package com.phillippitts.voicenav.domain;
