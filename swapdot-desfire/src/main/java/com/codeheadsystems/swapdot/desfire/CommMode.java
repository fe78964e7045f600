package com.codeheadsystems.swapdot.desfire;

/**
 * File communication settings of a DESFire data file.
 */
public enum CommMode {
  PLAIN,
  MACED,
  ENCIPHERED
}
