/**
 * Domain model for dialogue synthesis: voices, characters, script segments and PCM audio.
 *
 * <p>{@link com.phillippitts.dialoguetts.domain.DialogueSegment#index()} is the reassembly key
 * for a run; nothing downstream of the parser reorders segments by anything else.
 */
package com.phillippitts.dialoguetts.domain;
