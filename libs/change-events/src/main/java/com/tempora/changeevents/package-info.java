/**
 * Change events describing committed versions, handed to audit sinks.
 *
 * <ul>
 *   <li>{@link com.tempora.changeevents.ChangeEvent}: immutable event record
 *   <li>{@link com.tempora.changeevents.ChangeEventFactory}: event ID generation and change-type
 *       classification
 *   <li>{@link com.tempora.changeevents.ChangeEventSerializer}: Jackson JSON codec
 *   <li>{@link com.tempora.changeevents.ChangeEventValidator}: required-field checks
 * </ul>
 */
package com.tempora.changeevents;
