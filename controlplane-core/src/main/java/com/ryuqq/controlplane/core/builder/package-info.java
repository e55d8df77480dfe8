/**
 * Template image builder SPI.
 */
package com.ryuqq.controlplane.core.builder;
