/**
 * Small shared helpers: thread naming and the JSON codecs used for stored columns.
 */
package io.campaign.util;
