/**
 * CMX 3600 Codec Implementation
 * =============================================================================
 *
 * <p>Concrete decoder and encoder behind the
 * {@link com.questrail.edl.cmx3600.codec.EdlDecoder} and
 * {@link com.questrail.edl.cmx3600.codec.EdlEncoder} boundary.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   Reader
 *        → DefaultEdlDecoder.read      (EdlDocument)
 *        → TimelineBuilder             (Timeline)
 *
 *   Timeline
 *        → DefaultEdlEncoder.events    (one TrackSerializer pass per track)
 *        → EventWriter                 (Writer)
 * </pre>
 *
 * <p>Both classes are stateless apart from their configuration.</p>
 */
package com.questrail.edl.cmx3600.codec.impl;
