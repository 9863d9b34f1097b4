/**
 * Command admission: typed parameter decoding, the declarative interlock
 * table, the validator that applies them and the ledger that tracks admitted
 * commands until the equipment reports back.
 */
package com.gsesentinel.core.command;
