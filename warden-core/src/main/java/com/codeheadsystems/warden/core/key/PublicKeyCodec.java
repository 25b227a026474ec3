package com.codeheadsystems.warden.core.key;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAPublicKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Converts an RSA public key to and from its distributable encodings.
 * <p>
 * A single {@link RSAPublicKey} is the internal representation; every encoding is produced from
 * it and parses back to the same modulus and exponent. In the XML form, integers are unsigned
 * big-endian, except that a value whose first byte has the high bit set carries a leading zero
 * byte so that two's-complement consumers do not read it as negative.
 */
public class PublicKeyCodec {

  /**
   * PEM type label for SubjectPublicKeyInfo.
   */
  public static final String PEM_TYPE = "PUBLIC KEY";

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getMimeDecoder();

  private PublicKeyCodec() {
  }

  /**
   * Encodes the key in the requested format. Text formats are returned as UTF-8 bytes.
   *
   * @param publicKey the public key
   * @param encoding  the encoding
   * @return the encoded key
   */
  public static byte[] encode(RSAPublicKey publicKey, PublicKeyEncoding encoding) {
    return switch (encoding) {
      case PEM -> toPem(publicKey).getBytes(StandardCharsets.UTF_8);
      case DER_BASE64 -> B64.encodeToString(publicKey.getEncoded()).getBytes(StandardCharsets.UTF_8);
      case XML -> toXml(publicKey).getBytes(StandardCharsets.UTF_8);
    };
  }

  /**
   * Parses a key previously produced by {@link #encode}.
   *
   * @param encoded  the encoded key
   * @param encoding the encoding
   * @return the rsa public key
   * @throws IllegalArgumentException if the input is not a valid RSA key in that encoding
   */
  public static RSAPublicKey decode(byte[] encoded, PublicKeyEncoding encoding) {
    String text = new String(encoded, StandardCharsets.UTF_8);
    return switch (encoding) {
      case PEM -> fromPem(text);
      case DER_BASE64 -> fromDer(decodeBase64(text.trim(), "DER_BASE64"));
      case XML -> fromXml(text);
    };
  }

  /**
   * Wraps SubjectPublicKeyInfo DER in PEM armor.
   *
   * @param publicKey the public key
   * @return the pem string
   */
  public static String toPem(PublicKey publicKey) {
    StringWriter out = new StringWriter();
    try (PemWriter writer = new PemWriter(out)) {
      writer.writeObject(new PemObject(PEM_TYPE, publicKey.getEncoded()));
    } catch (IOException e) {
      throw new IllegalStateException("Unable to write PEM", e);
    }
    return out.toString();
  }

  /**
   * Reads a PEM {@code PUBLIC KEY} block.
   *
   * @param pem the pem text
   * @return the rsa public key
   */
  public static RSAPublicKey fromPem(String pem) {
    try (PemReader reader = new PemReader(new StringReader(pem))) {
      PemObject object = reader.readPemObject();
      if (object == null || !PEM_TYPE.equals(object.getType())) {
        throw new IllegalArgumentException("Input is not a PEM public key");
      }
      return fromDer(object.getContent());
    } catch (IOException e) {
      throw new IllegalArgumentException("Invalid PEM public key", e);
    }
  }

  /**
   * Reads SubjectPublicKeyInfo DER.
   *
   * @param der the der bytes
   * @return the rsa public key
   */
  public static RSAPublicKey fromDer(byte[] der) {
    try {
      PublicKey key = KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
      return (RSAPublicKey) key;
    } catch (GeneralSecurityException | ClassCastException e) {
      throw new IllegalArgumentException("Invalid RSA public key", e);
    }
  }

  /**
   * Produces the {@code <RSAKeyValue>} form.
   *
   * @param publicKey the public key
   * @return the xml string
   */
  public static String toXml(RSAPublicKey publicKey) {
    return "<RSAKeyValue>"
        + "<Modulus>" + B64.encodeToString(unsignedWithSignGuard(publicKey.getModulus())) + "</Modulus>"
        + "<Exponent>" + B64.encodeToString(unsignedWithSignGuard(publicKey.getPublicExponent())) + "</Exponent>"
        + "</RSAKeyValue>";
  }

  /**
   * Parses the {@code <RSAKeyValue>} form.
   *
   * @param xml the xml
   * @return the rsa public key
   */
  public static RSAPublicKey fromXml(String xml) {
    Document document = parseXml(xml);
    Element root = document.getDocumentElement();
    if (!"RSAKeyValue".equals(root.getTagName())) {
      throw new IllegalArgumentException("Expected <RSAKeyValue> root element");
    }
    BigInteger modulus = new BigInteger(1, decodeBase64(childText(root, "Modulus"), "Modulus"));
    BigInteger exponent = new BigInteger(1, decodeBase64(childText(root, "Exponent"), "Exponent"));
    try {
      return (RSAPublicKey) KeyFactory.getInstance("RSA")
          .generatePublic(new RSAPublicKeySpec(modulus, exponent));
    } catch (GeneralSecurityException e) {
      throw new IllegalArgumentException("Invalid RSA key values", e);
    }
  }

  /**
   * Big-endian magnitude of a positive integer, with a leading zero byte when the first byte
   * would otherwise have its high bit set.
   *
   * @param value the value
   * @return the byte [ ]
   */
  static byte[] unsignedWithSignGuard(BigInteger value) {
    byte[] bytes = value.toByteArray();
    // toByteArray() is minimal two's complement; drop a zero byte it did not need.
    if (bytes.length > 1 && bytes[0] == 0 && (bytes[1] & 0x80) == 0) {
      byte[] trimmed = new byte[bytes.length - 1];
      System.arraycopy(bytes, 1, trimmed, 0, trimmed.length);
      return trimmed;
    }
    return bytes;
  }

  private static Document parseXml(String xml) {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setExpandEntityReferences(false);
      factory.setNamespaceAware(false);
      DocumentBuilder builder = factory.newDocumentBuilder();
      builder.setErrorHandler(null);
      return builder.parse(new InputSource(new StringReader(xml)));
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser unavailable", e);
    } catch (SAXException | IOException e) {
      throw new IllegalArgumentException("Invalid key XML", e);
    }
  }

  private static String childText(Element root, String name) {
    NodeList nodes = root.getElementsByTagName(name);
    if (nodes.getLength() != 1) {
      throw new IllegalArgumentException("Expected exactly one <" + name + "> element");
    }
    return nodes.item(0).getTextContent().trim();
  }

  private static byte[] decodeBase64(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in field: " + fieldName, e);
    }
  }
}
