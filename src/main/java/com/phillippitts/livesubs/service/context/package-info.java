/**
 * Rolling conversation context: a bounded window of recent turns plus a periodically refreshed
 * summary, read through immutable snapshots.
 */
package com.phillippitts.livesubs.service.context;
