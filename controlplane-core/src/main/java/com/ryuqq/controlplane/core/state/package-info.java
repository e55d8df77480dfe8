/**
 * The versioned state document and its collection catalogue.
 */
package com.ryuqq.controlplane.core.state;
