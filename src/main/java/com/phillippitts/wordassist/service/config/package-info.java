/**
 * Provider configuration persisted as one JSON blob.
 *
 * <p>API keys are encrypted per provider with AES-GCM under a PBKDF2 key derived from a fixed
 * passphrase and the provider's salt. Older blob versions and legacy provider ids are migrated on
 * load and the migrated blob is written back.
 */
package com.phillippitts.wordassist.service.config;
